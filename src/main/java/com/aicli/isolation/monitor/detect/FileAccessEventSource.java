package com.aicli.isolation.monitor.detect;

import java.util.List;

/**
 * Hands over the file access events observed since the previous call.
 */
@FunctionalInterface
public interface FileAccessEventSource {

    FileAccessEventSource NONE = List::of;

    List<FileAccessEvent> drain();
}
