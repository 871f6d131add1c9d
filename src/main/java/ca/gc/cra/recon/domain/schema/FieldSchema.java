package ca.gc.cra.recon.domain.schema;

import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Static registry of the dotted paths that hold arrays in a record collection.
 * <p><strong>Why:</strong> Records are schemaless documents; traversal, projection, and filtering need to know
 * which path segments must be mapped element-wise.</p>
 * <p><strong>Role:</strong> Domain value consulted by the path extractor, the projector, and the filter evaluator.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 * <p><strong>Performance:</strong> Constant-time hash lookups per path.</p>
 *
 * @implNote Unknown paths are reported as non-array values.
 * @since 0.1.0
 */
public final class FieldSchema {
  /** Array-valued paths of active scan (host) records. */
  public static final FieldSchema HOSTS = new FieldSchema("hosts", Set.of(
      "categories",
      "cpes",
      "hostnames",
      "hostnames.domains",
      "openports.protocols",
      "os.osclass",
      "os.osmatch",
      "os.portused",
      "ports",
      "ports.screenwords",
      "ports.scripts",
      "ports.scripts.dns-domains",
      "ports.scripts.dns-domains.parents",
      "ports.scripts.fcrdns",
      "ports.scripts.fcrdns.addresses",
      "ports.scripts.http-headers",
      "ports.scripts.http-user-agent",
      "ports.scripts.ike-info.transforms",
      "ports.scripts.ike-info.vendor_ids",
      "ports.scripts.ls.volumes",
      "ports.scripts.ls.volumes.files",
      "ports.scripts.mongodb-databases.databases",
      "ports.scripts.mongodb-databases.databases.shards",
      "ports.scripts.rpcinfo",
      "ports.scripts.rpcinfo.version",
      "ports.scripts.smb-enum-shares.shares",
      "ports.scripts.ssh-hostkey",
      "ports.scripts.ssl-ja3-client",
      "ports.scripts.ssl-ja3-server",
      "ports.scripts.vulns",
      "ports.scripts.vulns.check_results",
      "ports.scripts.vulns.description",
      "ports.scripts.vulns.extra_info",
      "ports.scripts.vulns.ids",
      "ports.scripts.vulns.refs",
      "scanid",
      "traces",
      "traces.hops",
      "traces.hops.domains"));

  /** Array-valued paths of passive observation records. */
  public static final FieldSchema PASSIVE = new FieldSchema("passive", Set.of(
      "infos.domain",
      "infos.domaintarget",
      "infos.san"));

  /** Scan documents carry no array-valued paths the engine needs to traverse. */
  public static final FieldSchema SCANS = new FieldSchema("scans", Set.of());

  private final String name;
  private final Set<String> listFields;

  /**
   * Creates a registry.
   *
   * @param name collection label used in logs
   * @param listFields dotted paths whose values are arrays
   */
  public FieldSchema(String name, Set<String> listFields) {
    this.name = Objects.requireNonNull(name, "name");
    this.listFields = Set.copyOf(Objects.requireNonNull(listFields, "listFields"));
  }

  /**
   * Indicates whether {@code path} holds an array.
   *
   * @param path full dotted path from the record root
   * @return {@code true} only for registered array paths
   */
  public boolean isList(String path) {
    return path != null && listFields.contains(path);
  }

  /**
   * Joins a base path and a child segment the same way every traversal in the engine does.
   *
   * @param base parent path, empty for the record root
   * @param segment child key
   * @return dotted path
   */
  public static String join(String base, String segment) {
    if (base == null || base.isEmpty()) {
      return segment;
    }
    return base + '.' + segment;
  }

  public Set<String> listFields() {
    return listFields;
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return "FieldSchema[" + name + ", " + listFields.size() + " list fields]";
  }
}
