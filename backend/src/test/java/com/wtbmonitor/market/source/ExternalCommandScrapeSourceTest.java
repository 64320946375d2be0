package com.wtbmonitor.market.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wtbmonitor.config.MonitorProperties;
import com.wtbmonitor.market.model.ScrapeKind;
import com.wtbmonitor.market.model.StoreTarget;
import com.wtbmonitor.market.state.ProgressChannel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ExternalCommandScrapeSourceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void stdoutIsParsedAndStderrBecomesProgress() throws Exception {
        ExternalCommandScrapeSource source = source(
            "echo 'Scraping store 1/1' >&2; echo '[{\"name\":\"Samba\",\"price_min\":900},{\"name\":\"Gazelle\"}]'",
            10
        );
        ProgressChannel channel = new ProgressChannel();

        List<Map<String, Object>> items = source.fetch(channel);
        channel.close();
        List<String> progress = new ArrayList<>();
        channel.drain(progress::add);

        assertThat(items).hasSize(2);
        assertThat(items.get(0)).containsEntry("name", "Samba").containsEntry("price_min", 900);
        assertThat(progress).containsExactly("Scraping store 1/1");
    }

    @Test
    void emptyOutputYieldsNoItems() {
        assertThat(source("true", 10).fetch(new ProgressChannel())).isEmpty();
    }

    @Test
    void nonZeroExitFails() {
        assertThatThrownBy(() -> source("exit 3", 10).fetch(new ProgressChannel()))
            .isInstanceOf(ScrapeSourceException.class)
            .hasMessageContaining("code 3");
    }

    @Test
    void unparseableOutputFails() {
        assertThatThrownBy(() -> source("echo 'not json'", 10).fetch(new ProgressChannel()))
            .isInstanceOf(ScrapeSourceException.class);
    }

    @Test
    void slowCommandTimesOut() {
        assertThatThrownBy(() -> source("sleep 30", 1).fetch(new ProgressChannel()))
            .isInstanceOf(ScrapeSourceException.class)
            .hasMessageContaining("timed out");
    }

    @Test
    void enabledTargetsAreWrittenBeforeTheRun(@TempDir Path workingDir) throws Exception {
        MonitorProperties.Command command = new MonitorProperties.Command();
        command.setCommand(List.of("sh", "-c", "test -s stores.json && echo '[]'"));
        command.setWorkingDir(workingDir.toString());
        command.setTargetsFile("stores.json");
        ExternalCommandScrapeSource source = new ExternalCommandScrapeSource(
            ScrapeKind.WTB,
            command,
            objectMapper,
            () -> List.of(new StoreTarget(1L, "Adonio", "https://www.wtbmarketlist.eu/store/adonio", true))
        );
        ProgressChannel channel = new ProgressChannel();

        assertThat(source.fetch(channel)).isEmpty();
        channel.close();
        List<String> progress = new ArrayList<>();
        channel.drain(progress::add);

        Map<String, List<Map<String, Object>>> written = objectMapper.readValue(
            Files.readString(workingDir.resolve("stores.json")),
            new TypeReference<Map<String, List<Map<String, Object>>>>() {}
        );
        assertThat(written.get("stores")).hasSize(1);
        assertThat(written.get("stores").get(0))
            .containsEntry("name", "Adonio")
            .containsEntry("url", "https://www.wtbmarketlist.eu/store/adonio")
            .containsEntry("enabled", true);
        assertThat(progress).contains("Loaded 1 store targets");
    }

    @Test
    void runWithoutEnabledTargetsFailsBeforeStarting(@TempDir Path workingDir) {
        MonitorProperties.Command command = new MonitorProperties.Command();
        command.setCommand(List.of("sh", "-c", "touch started"));
        command.setWorkingDir(workingDir.toString());
        command.setTargetsFile("stores.json");
        ExternalCommandScrapeSource source = new ExternalCommandScrapeSource(ScrapeKind.WTB, command, objectMapper, List::of);

        assertThatThrownBy(() -> source.fetch(new ProgressChannel()))
            .isInstanceOf(ScrapeSourceException.class)
            .hasMessageContaining("No enabled store targets");
        assertThat(workingDir.resolve("started")).doesNotExist();
        assertThat(workingDir.resolve("stores.json")).doesNotExist();
    }

    @Test
    void emptyCommandIsUnavailable() {
        ExternalCommandScrapeSource source =
            new ExternalCommandScrapeSource(ScrapeKind.INVENTORY, new MonitorProperties.Command(), objectMapper);

        assertThat(source.isAvailable()).isFalse();
        assertThatThrownBy(() -> source.fetch(new ProgressChannel())).isInstanceOf(ScrapeSourceException.class);
    }

    private ExternalCommandScrapeSource source(String script, int timeoutSeconds) {
        MonitorProperties.Command command = new MonitorProperties.Command();
        command.setCommand(List.of("sh", "-c", script));
        command.setTimeoutSeconds(timeoutSeconds);
        command.setOriginLabel("test-scraper");
        return new ExternalCommandScrapeSource(ScrapeKind.WTB, command, objectMapper);
    }
}
