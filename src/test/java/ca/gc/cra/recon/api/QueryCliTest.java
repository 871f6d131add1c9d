package ca.gc.cra.recon.api;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class QueryCliTest {
  @TempDir
  Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    logger = (Logger) LoggerFactory.getLogger(QueryCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    logger.detachAppender(appender);
  }

  private ExitCode run(String... args) {
    return Main.run(args);
  }

  private List<String> output() {
    String text = buffer.toString();
    buffer.getBuffer().setLength(0);
    return Arrays.stream(text.split("\\R")).filter(line -> !line.isBlank()).collect(Collectors.toList());
  }

  private Path db() {
    return tempDir.resolve("db");
  }

  private void loadHosts() throws Exception {
    Path hosts = tempDir.resolve("hosts.ndjson");
    Files.write(hosts, List.of(
        "{\"_id\":\"h1\",\"addr\":\"192.0.2.10\",\"infos\":{\"as_num\":15169},"
            + "\"ports\":[{\"protocol\":\"tcp\",\"port\":80,\"state_state\":\"open\"},"
            + "{\"protocol\":\"tcp\",\"port\":22,\"state_state\":\"closed\"}]}",
        "",
        "{\"_id\":\"h2\",\"addr\":\"198.51.100.7\",\"infos\":{\"as_num\":8075},"
            + "\"ports\":[{\"protocol\":\"tcp\",\"port\":443,\"state_state\":\"open\"}]}"),
        StandardCharsets.UTF_8);
    assertEquals(ExitCode.SUCCESS, run("load", "db=" + db(), "file=" + hosts));
    assertEquals(List.of("2"), output());
  }

  @Test
  void loadsThenCountsAndAggregatesHosts() throws Exception {
    loadHosts();

    assertEquals(ExitCode.SUCCESS, run("count", "db=" + db(), "port=80"));
    assertEquals(List.of("1"), output());

    assertEquals(ExitCode.SUCCESS, run("count", "db=" + db(), "!port=80"));
    assertEquals(List.of("1"), output());

    assertEquals(ExitCode.SUCCESS, run("top", "db=" + db(), "field=port:open"));
    assertEquals(List.of("{\"_id\":[\"tcp\",80],\"count\":1}", "{\"_id\":[\"tcp\",443],\"count\":1}"), output());

    assertEquals(ExitCode.SUCCESS, run("distinct", "db=" + db(), "field=infos.as_num"));
    assertEquals(List.of("15169", "8075"), output());

    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().startsWith("Running top on collection nmap")));
  }

  @Test
  void getPrintsProjectedRecords() throws Exception {
    loadHosts();

    assertEquals(ExitCode.SUCCESS, run("get", "db=" + db(), "net=198.51.100.0/24", "fields=addr"));
    assertEquals(List.of("{\"addr\":\"198.51.100.7\",\"_id\":\"h2\"}"), output());
  }

  @Test
  void passiveSightingsAreMergedOnLoad() throws Exception {
    Path passive = tempDir.resolve("passive.ndjson");
    String record = "\"addr\":\"192.0.2.1\",\"sensor\":\"s1\",\"recontype\":\"OPEN_PORT\",\"port\":443,"
        + "\"source\":\"TCP\",\"value\":\"open\"";
    Files.write(passive, List.of(
        "{\"timestamp\":10," + record + "}",
        "{\"timestamp\":5," + record + "}",
        "{\"timestamp\":20," + record + "}"), StandardCharsets.UTF_8);

    assertEquals(ExitCode.SUCCESS, run("load", "collection=passive", "db=" + db(), "file=" + passive));
    assertEquals(List.of("3"), output());

    assertEquals(ExitCode.SUCCESS, run("get", "collection=passive", "db=" + db(), "sensor=s1"));
    List<String> lines = output();
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).contains("\"count\":3"), lines.get(0));
    assertTrue(lines.get(0).contains("\"firstseen\":\"1970-01-01T00:00:05Z\""), lines.get(0));
    assertTrue(lines.get(0).contains("\"lastseen\":\"1970-01-01T00:00:20Z\""), lines.get(0));

    assertEquals(ExitCode.SUCCESS, run("top", "collection=passive", "db=" + db(), "field=sensor", "--weighted"));
    assertEquals(List.of("{\"_id\":\"s1\",\"count\":3}"), output());
  }

  @Test
  void reportsUsageErrors() throws Exception {
    assertEquals(ExitCode.INVALID_ARGS, run("count", "db=" + db()));
    output();

    loadHosts();
    assertEquals(ExitCode.INVALID_ARGS, run("count", "db=" + db(), "colour=blue"));
    assertEquals(ExitCode.INVALID_ARGS, run("count", "db=" + db(), "sensor=s1"));
    assertEquals(ExitCode.INVALID_ARGS, run("top", "db=" + db()));
    assertEquals(ExitCode.INVALID_ARGS, run("top", "db=" + db(), "field=asnum", "--weighted"));
    assertEquals(ExitCode.INVALID_ARGS, run("count", "db"));
    assertEquals(ExitCode.CONFIG_ERROR, run("top", "db=" + db(), "field=asnum", "topnbr=0"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("unknown filter: colour")));
  }

  @Test
  void yamlConfigurationSuppliesSettings() throws Exception {
    loadHosts();
    Path yaml = tempDir.resolve("recon.yaml");
    Files.writeString(yaml, "common:\n  db: " + db() + "\nnmap:\n  topnbr: 1\n");

    assertEquals(ExitCode.SUCCESS, run("top", "config=" + yaml, "field=asnum"));
    assertEquals(1, output().size());
  }

  @Test
  void yamlStorePathAndPagingApply() throws Exception {
    loadHosts();
    Path yaml = tempDir.resolve("paging.yaml");
    Files.writeString(yaml, "common:\n  store:\n    path: db\n  query:\n    limit: 1\n");

    assertEquals(ExitCode.SUCCESS, run("get", "config=" + yaml));
    assertEquals(1, output().size());
    assertEquals(ExitCode.SUCCESS, run("get", "config=" + yaml, "limit=5"));
    assertEquals(2, output().size());
    assertEquals(ExitCode.SUCCESS, run("get", "db=" + db(), "skip=1", "limit=" + Integer.MAX_VALUE));
    assertEquals(1, output().size());
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, run("top", "--help"));
    assertTrue(output().stream().anyMatch(line -> line.contains("recon top")));
  }
}
