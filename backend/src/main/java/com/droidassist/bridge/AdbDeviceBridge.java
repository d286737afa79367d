package com.droidassist.bridge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Device bridge backed by the adb executable.
 *
 * Each invocation spawns one adb process; stdout and stderr are merged and
 * drained concurrently so a large dumpsys output cannot stall the process
 * before the timeout is checked.
 */
@Component
@Slf4j
public class AdbDeviceBridge implements DeviceBridge {

    static final String UI_DUMP_PATH = "/sdcard/window_dump.xml";

    @Value("${droidassist.bridge.executable:adb}")
    private String executable;

    @Value("${droidassist.bridge.serial:}")
    private String serial;

    @Override
    public String readTelephonyRegistry(Duration timeout) {
        return execute(timeout, "shell", "dumpsys", "telephony.registry");
    }

    @Override
    public String readCallStateProperty(Duration timeout) {
        return execute(timeout, "shell", "getprop", "gsm.voice.call.state");
    }

    @Override
    public String readAudioState(Duration timeout) {
        return execute(timeout, "shell", "dumpsys", "audio");
    }

    @Override
    public void answerCall(Duration timeout) {
        execute(timeout, "shell", "input", "keyevent", "KEYCODE_CALL");
    }

    @Override
    public void hangUp(Duration timeout) {
        execute(timeout, "shell", "input", "keyevent", "KEYCODE_ENDCALL");
    }

    @Override
    public void speak(String text, Duration timeout) {
        String quoted = shellQuote(text);
        try {
            execute(timeout, "shell", "cmd", "media_session", "dispatch", "com.android.tts", "speak", quoted);
        } catch (DeviceBridgeException e) {
            if (e.isTimedOut()) {
                throw e;
            }
            log.warn("TTS dispatch failed, falling back to TTS intent: {}", e.getMessage());
            execute(timeout, "shell", "am", "start",
                "-a", "android.speech.tts.engine.INTENT_ACTION_TTS_SERVICE",
                "--es", "android.speech.tts.extra.UTTERANCE_ID", "auto_answer",
                "--es", "android.speech.tts.extra.TEXT", quoted);
        }
    }

    @Override
    public String dumpUiHierarchy(Duration timeout) {
        execute(timeout, "shell", "uiautomator", "dump", UI_DUMP_PATH);
        return execute(timeout, "shell", "cat", UI_DUMP_PATH);
    }

    String execute(Duration timeout, String... args) {
        List<String> command = buildCommand(args);
        String printable = String.join(" ", command);
        log.debug("adb: {}", printable);

        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            throw new DeviceBridgeException(printable, "Failed to start bridge process", false, e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                process.destroyForcibly();
                throw DeviceBridgeException.timeout(printable, timeout);
            }
            long remaining = Math.max(deadline - System.nanoTime(), TimeUnit.MILLISECONDS.toNanos(50));
            String text = output.get(remaining, TimeUnit.NANOSECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new DeviceBridgeException(printable,
                    "Exited with code " + exitCode + ": " + abbreviate(text));
            }
            return text;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DeviceBridgeException(printable, "Interrupted", false, e);
        } catch (TimeoutException e) {
            process.destroyForcibly();
            throw DeviceBridgeException.timeout(printable, timeout);
        } catch (ExecutionException e) {
            throw new DeviceBridgeException(printable, "Failed to read bridge output", false, e.getCause());
        }
    }

    List<String> buildCommand(String... args) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        if (serial != null && !serial.isBlank()) {
            command.add("-s");
            command.add(serial);
        }
        command.addAll(List.of(args));
        return command;
    }

    static String shellQuote(String text) {
        return "'" + text.replace("'", "'\\''") + "'";
    }

    private static String readFully(InputStream in) {
        try (in) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String abbreviate(String text) {
        String trimmed = text == null ? "" : text.strip();
        return trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
    }
}
