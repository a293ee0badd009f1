package com.phillippitts.granupose.service.engine;

import com.phillippitts.granupose.domain.engine.LogChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Drains one engine output stream line by line into the {@link EngineLogBuffer}.
 *
 * <p>Runs on its own daemon thread until the stream closes, so a chatty engine can never
 * block on a full pipe.
 */
final class EngineOutputReader implements Runnable {

    private static final Logger LOG = LogManager.getLogger(EngineOutputReader.class);

    private final InputStream inputStream;
    private final LogChannel channel;
    private final EngineLogBuffer logBuffer;

    private EngineOutputReader(InputStream inputStream, LogChannel channel, EngineLogBuffer logBuffer) {
        this.inputStream = inputStream;
        this.channel = channel;
        this.logBuffer = logBuffer;
    }

    static Thread start(InputStream inputStream, LogChannel channel, EngineLogBuffer logBuffer, long pid) {
        Thread thread = new Thread(new EngineOutputReader(inputStream, channel, logBuffer),
                "engine-" + channel.name().toLowerCase(Locale.ROOT) + "-" + pid);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                logBuffer.append(channel, line);
            }
        } catch (IOException e) {
            // Stream closed underneath us when the process is killed
            LOG.debug("Engine {} reader stopped: {}", channel, e.getMessage());
        }
    }
}
