package ca.gc.cra.recon.application.topvalues;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.recon.application.port.ClockPort;
import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.application.query.ScanResultService;
import ca.gc.cra.recon.domain.schema.FieldSchema;
import ca.gc.cra.recon.infrastructure.store.InMemoryDocumentStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HostPseudoFieldsTest {
  private ScanResultService service;

  @BeforeEach
  void setUp() {
    InMemoryDocumentStore hosts = new InMemoryDocumentStore(FieldSchema.HOSTS);
    InMemoryDocumentStore scans = new InMemoryDocumentStore(FieldSchema.SCANS);
    service = new ScanResultService(() -> hosts, () -> scans, MetricsPort.NO_OP, ClockPort.SYSTEM);

    service.storeHost(Map.of(
        "_id", "h1",
        "addr", "192.0.2.10",
        "ports", List.of(
            Map.of("protocol", "tcp", "port", 80, "state_state", "open", "service_name", "http",
                "service_product", "Apache httpd", "service_version", "2.4.41",
                "scripts", List.of(Map.of(
                    "id", "http-headers",
                    "output", "Server: Apache",
                    "http-headers", List.of(
                        Map.of("name", "server", "value", "Apache"),
                        Map.of("name", "content-type", "value", "text/html"))))),
            Map.of("protocol", "tcp", "port", 22, "state_state", "open", "service_name", "ssh",
                "service_product", "OpenSSH", "service_version", "8.2"),
            Map.of("protocol", "tcp", "port", 25, "state_state", "closed"),
            Map.of("port", -1, "scripts", List.of(Map.of("id", "whois", "output", "host-level whois")))),
        "cpes", List.of(
            Map.of("type", "a", "vendor", "apache", "product", "http_server", "version", "2.4.41"),
            Map.of("type", "o", "vendor", "linux", "product", "linux_kernel", "version", "5.4")),
        "traces", List.of(Map.of("hops", List.of(
            Map.of("ttl", 1, "ipaddr", "10.0.0.1"),
            Map.of("ttl", 3, "ipaddr", "10.0.0.5"))))));

    service.storeHost(Map.of(
        "_id", "h2",
        "addr", "192.0.2.20",
        "ports", List.of(
            Map.of("protocol", "tcp", "port", 80, "state_state", "open", "service_name", "http",
                "service_product", "nginx", "service_version", "1.18",
                "scripts", List.of(
                    Map.of("id", "ssl-ja3-server", "output", "ja3",
                        "ssl-ja3-server", List.of(Map.of("md5", "server-md5", "client", Map.of("md5", "client-md5")))),
                    Map.of("id", "http-headers", "output", "Server: nginx",
                        "http-headers", List.of(Map.of("name", "server", "value", "nginx"))))),
            Map.of("protocol", "tcp", "port", 443, "state_state", "open", "service_name", "https",
                "scripts", List.of(
                    Map.of("id", "http-vuln-cve2017-5638", "output", "VULNERABLE",
                        "vulns", List.of(Map.of("id", "CVE-2017-5638", "state", "VULNERABLE"))),
                    Map.of("id", "smb-ls", "output", "listing",
                        "ls", Map.of("volumes", List.of(Map.of(
                            "volume", "C$",
                            "files", List.of(Map.of("filename", "boot.ini", "size", 211)))))))),
            Map.of("protocol", "tcp", "port", 22, "state_state", "filtered")),
        "cpes", List.of(Map.of("type", "a", "vendor", "nginx", "product", "nginx", "version", "1.18"))));
  }

  private List<TopValue> top(String field) {
    return service.topValues(field, null, 10);
  }

  @Test
  void countsPortsPerHostInState() {
    assertEquals(List.of(new TopValue(2L, 2)), top("countports:open"));
    assertEquals(List.of(new TopValue(0L, 1), new TopValue(1L, 1)), top("countports:filtered"));
  }

  @Test
  void portTuplesLeaveOutHostLevelEntry() {
    List<TopValue> ports = top("port");
    assertEquals(List.of(
        new TopValue(List.of("tcp", 80), 2),
        new TopValue(List.of("tcp", 22), 2),
        new TopValue(List.of("tcp", 25), 1),
        new TopValue(List.of("tcp", 443), 1)), ports);
    assertTrue(ports.stream().noneMatch(v -> ((List<?>) v.value()).contains(-1)));
  }

  @Test
  void portListsAreSortedPerHost() {
    assertEquals(List.of(
        new TopValue(List.of(List.of("tcp", 22), List.of("tcp", 80)), 1),
        new TopValue(List.of(List.of("tcp", 80), List.of("tcp", 443)), 1)), top("portlist:open"));
  }

  @Test
  void servicesProductsAndVersionsOfOpenPorts() {
    assertEquals(List.of(new TopValue("http", 2)), top("service:80"));
    assertEquals(List.of(
        new TopValue(List.of("http", "Apache httpd"), 1),
        new TopValue(List.of("http", "nginx"), 1)), top("product:http"));
    assertEquals(List.of(new TopValue(List.of("http", "nginx", "1.18"), 1)), top("version:http:nginx"));
    assertEquals(List.of(
        new TopValue(List.of("http", "Apache httpd", "2.4.41"), 1),
        new TopValue(List.of("http", "nginx", "1.18"), 1)), top("version:80"));
    assertThrows(IllegalArgumentException.class, () -> top("service:70000"));
  }

  @Test
  void cpeTuplesStopAtRequestedPart() {
    assertEquals(List.of(
        new TopValue(List.of("a", "apache"), 1),
        new TopValue(List.of("o", "linux"), 1),
        new TopValue(List.of("a", "nginx"), 1)), top("cpe.vendor"));
    assertEquals(new TopValue(List.of("a", "apache", "http_server", "2.4.41"), 1), top("cpe").get(0));
    assertEquals(List.of(
        new TopValue(List.of("a", "apache", "http_server"), 1),
        new TopValue(List.of("a", "nginx", "nginx"), 1)), top("cpe.product:a"));
  }

  @Test
  void hostLevelScriptsUseSentinelPort() {
    assertEquals(List.of(new TopValue("host-level whois", 1)), top("script:host:whois"));
    assertTrue(top("script:80:whois").isEmpty());
  }

  @Test
  void hopsFilterOnTtl() {
    assertEquals(List.of(new TopValue("10.0.0.5", 1)), top("hop>2"));
    assertEquals(List.of(new TopValue("10.0.0.1", 1)), top("hop:1"));
  }

  @Test
  void ja3ServerPairsServerAndClientHashes() {
    assertEquals(List.of(new TopValue(List.of("server-md5", "client-md5"), 1)), top("ja3-server"));
  }

  @Test
  void vulnerabilitiesPairIdentifierWithField() {
    assertEquals(List.of(new TopValue(List.of("CVE-2017-5638", "VULNERABLE"), 1)), top("vulns.state"));
  }

  @Test
  void filesListedByScripts() {
    assertEquals(List.of(new TopValue("boot.ini", 1)), top("file"));
    assertEquals(List.of(new TopValue(211, 1)), top("file.size"));
    assertEquals(List.of(new TopValue("boot.ini", 1)), top("file:smb-ls"));
    assertTrue(top("file:ftp-anon").isEmpty());
  }

  @Test
  void httpHeadersByName() {
    assertEquals(List.of(new TopValue("Apache", 1), new TopValue("nginx", 1)), top("httphdr:Server"));
    assertEquals(List.of(
        new TopValue(List.of("server", "Apache"), 1),
        new TopValue(List.of("content-type", "text/html"), 1),
        new TopValue(List.of("server", "nginx"), 1)), top("httphdr"));
  }
}
