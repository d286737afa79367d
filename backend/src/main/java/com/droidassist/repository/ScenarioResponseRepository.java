package com.droidassist.repository;

import com.droidassist.entity.ScenarioResponse;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScenarioResponseRepository extends JpaRepository<ScenarioResponse, String> {
}
