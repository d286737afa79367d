package com.droidassist.repository;

import com.droidassist.entity.MonitorSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MonitorSettingsRepository extends JpaRepository<MonitorSettings, Long> {
}
