package ca.gc.cra.recon.domain.schema;

import java.util.Map;

/**
 * Maps script identifiers to the key under which their structured output is stored.
 *
 * <p>Several scripts share one payload layout: vulnerability checks all store a {@code vulns} list and
 * {@code ssl-cert-intaddr} reuses {@code ssl-cert}.</p>
 *
 * @since 0.1.0
 */
public final class ScriptAliases {
  private static final Map<String, String> ALIASES = Map.ofEntries(
      Map.entry("ssl-cert-intaddr", "ssl-cert"),
      Map.entry("ftp-vsftpd-backdoor", "vulns"),
      Map.entry("http-vuln-cve2017-5638", "vulns"),
      Map.entry("http-vuln-cve2017-1001000", "vulns"),
      Map.entry("http-vuln-cve2014-3704", "vulns"),
      Map.entry("http-vuln-cve2015-1635", "vulns"),
      Map.entry("mysql-vuln-cve2012-2122", "vulns"),
      Map.entry("rdp-vuln-ms12-020", "vulns"),
      Map.entry("rmi-vuln-classloader", "vulns"),
      Map.entry("smb-double-pulsar-backdoor", "vulns"),
      Map.entry("smb-vuln-ms08-067", "vulns"),
      Map.entry("smb-vuln-ms10-054", "vulns"),
      Map.entry("smb-vuln-ms17-010", "vulns"),
      Map.entry("smtp-vuln-cve2010-4344", "vulns"),
      Map.entry("ssl-ccs-injection", "vulns"),
      Map.entry("ssl-dh-params", "vulns"),
      Map.entry("ssl-heartbleed", "vulns"),
      Map.entry("ssl-poodle", "vulns"),
      Map.entry("sslv2-drown", "vulns"));

  private ScriptAliases() {
    // Utility
  }

  /**
   * Returns the payload key of a script.
   *
   * @param scriptId script identifier
   * @return aliased key, or {@code scriptId} itself when the script has its own layout
   */
  public static String tableKey(String scriptId) {
    return ALIASES.getOrDefault(scriptId, scriptId);
  }
}
