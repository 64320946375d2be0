package com.wtbmonitor.market.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.StoreTarget;
import com.wtbmonitor.market.state.ProgressChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs an external scraper process. The process writes a JSON array of items to stdout and
 * human-readable progress lines to stderr. When a targets file is configured, the enabled store
 * targets are written to it as {@code {"stores": [...]}} before the process starts.
 */
public class ExternalCommandScrapeSource implements ScrapeSource {
    private static final Logger log = LoggerFactory.getLogger(ExternalCommandScrapeSource.class);
    private static final TypeReference<List<Map<String, Object>>> ITEM_LIST = new TypeReference<>() {};

    private final ScrapeKind kind;
    private final MonitorProperties.Command command;
    private final ObjectMapper objectMapper;
    private final Supplier<List<StoreTarget>> targets;

    public ExternalCommandScrapeSource(ScrapeKind kind, MonitorProperties.Command command, ObjectMapper objectMapper) {
        this(kind, command, objectMapper, List::of);
    }

    public ExternalCommandScrapeSource(
        ScrapeKind kind,
        MonitorProperties.Command command,
        ObjectMapper objectMapper,
        Supplier<List<StoreTarget>> targets
    ) {
        this.kind = kind;
        this.command = command;
        this.objectMapper = objectMapper;
        this.targets = targets;
    }

    @Override
    public ScrapeKind kind() {
        return kind;
    }

    @Override
    public String originLabel() {
        return command.getOriginLabel();
    }

    @Override
    public boolean isAvailable() {
        return !command.getCommand().isEmpty();
    }

    @Override
    public List<Map<String, Object>> fetch(ProgressChannel progress) {
        if (!isAvailable()) {
            throw new ScrapeSourceException("No scraper command configured for " + kind.label());
        }
        Path stdout = null;
        Process process = null;
        try {
            writeTargets(progress);
            stdout = Files.createTempFile("scrape-" + kind.name().toLowerCase(Locale.ROOT) + "-", ".json");
            ProcessBuilder builder = new ProcessBuilder(command.getCommand())
                .directory(new File(command.getWorkingDir()))
                .redirectOutput(stdout.toFile());
            log.info("Starting {} scraper: {}", kind.label(), String.join(" ", command.getCommand()));
            process = builder.start();
            Thread stderrPump = startStderrPump(process, progress);

            boolean finished = process.waitFor(command.getTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ScrapeSourceException(
                    kind.label() + " scraper timed out after " + command.getTimeoutSeconds() + "s"
                );
            }
            stderrPump.join(TimeUnit.SECONDS.toMillis(5));
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ScrapeSourceException(kind.label() + " scraper exited with code " + exitCode);
            }
            String json = Files.readString(stdout, StandardCharsets.UTF_8).trim();
            if (json.isEmpty()) {
                return List.of();
            }
            List<Map<String, Object>> items = objectMapper.readValue(json, ITEM_LIST);
            return items == null ? List.of() : items;
        } catch (IOException e) {
            throw new ScrapeSourceException("Unable to run " + kind.label() + " scraper: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new ScrapeSourceException(kind.label() + " scraper interrupted", e);
        } finally {
            if (stdout != null) {
                try {
                    Files.deleteIfExists(stdout);
                } catch (IOException e) {
                    log.warn("Failed to delete scraper output {}", stdout, e);
                }
            }
        }
    }

    private void writeTargets(ProgressChannel progress) throws IOException {
        String targetsFile = command.getTargetsFile();
        if (targetsFile == null) {
            return;
        }
        List<StoreTarget> enabled = targets.get();
        if (enabled.isEmpty()) {
            throw new ScrapeSourceException("No enabled store targets for " + kind.label() + " scraper");
        }
        Path path = Path.of(command.getWorkingDir()).resolve(targetsFile);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), Map.of("stores", enabled));
        progress.publish("Loaded " + enabled.size() + " store targets");
        log.debug("Wrote {} store targets to {}", enabled.size(), path);
    }

    private Thread startStderrPump(Process process, ProgressChannel progress) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8)
            )) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String trimmed = line.trim();
                    if (!trimmed.isEmpty()) {
                        progress.publish(trimmed);
                    }
                }
            } catch (IOException e) {
                log.debug("{} scraper stderr closed: {}", kind.label(), e.getMessage());
            }
        });
        thread.setName("scrape-stderr-" + kind.name().toLowerCase(Locale.ROOT));
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
