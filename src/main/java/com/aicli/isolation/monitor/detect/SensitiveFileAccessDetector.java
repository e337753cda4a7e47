package com.aicli.isolation.monitor.detect;

import com.aicli.isolation.core.model.Severity;
import com.aicli.isolation.core.model.WorkspaceMetrics;
import com.aicli.isolation.monitor.BreachType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reports access to sensitive host paths as unauthorized file access.
 */
public class SensitiveFileAccessDetector implements AnomalyDetector {

    public static final Set<String> DEFAULT_SENSITIVE_PATHS = Set.of(
            "/etc/shadow",
            "/etc/sudoers",
            "/etc/sudoers.d",
            "/root/.ssh",
            "/proc/kcore",
            "/var/run/docker.sock");

    private final FileAccessEventSource source;
    private final Set<String> sensitivePaths;

    public SensitiveFileAccessDetector(FileAccessEventSource source) {
        this(source, DEFAULT_SENSITIVE_PATHS);
    }

    public SensitiveFileAccessDetector(FileAccessEventSource source, Set<String> sensitivePaths) {
        this.source = source;
        this.sensitivePaths = Set.copyOf(sensitivePaths);
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.FILESYSTEM;
    }

    @Override
    public String name() {
        return "sensitive-files";
    }

    @Override
    public List<AnomalyFinding> detect(List<WorkspaceMetrics> samples) {
        var findings = new ArrayList<AnomalyFinding>();
        for (FileAccessEvent event : source.drain()) {
            if (event.workspaceId() == null || !isSensitive(event.path())) {
                continue;
            }
            var evidence = new LinkedHashMap<String, Object>();
            evidence.put("path", event.path());
            evidence.put("operation", String.valueOf(event.operation()));
            evidence.put("process", String.valueOf(event.process()));
            findings.add(AnomalyFinding.breach(event.workspaceId(),
                    BreachType.UNAUTHORIZED_FILE_ACCESS, Severity.ERROR,
                    "Access to sensitive path " + event.path(), evidence));
        }
        return findings;
    }

    boolean isSensitive(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        for (String prefix : sensitivePaths) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }
}
