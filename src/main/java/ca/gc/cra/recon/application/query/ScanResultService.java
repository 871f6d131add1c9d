package ca.gc.cra.recon.application.query;

import ca.gc.cra.recon.application.port.ClockPort;
import ca.gc.cra.recon.application.port.DocumentStorePort;
import ca.gc.cra.recon.application.port.MetricsPort;
import ca.gc.cra.recon.domain.filter.Filter;
import ca.gc.cra.recon.domain.filter.Filters;
import ca.gc.cra.recon.domain.record.DuplicateKeyException;
import ca.gc.cra.recon.domain.record.Records;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Host collection fed by scan result imports, paired with a collection of scan
 * documents.
 * <p><strong>Why:</strong> Each host lists the scans it came from; a scan document is only kept while at least
 * one host still references it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store hosts as-is; every scan yields its own host record.</li>
 *   <li>Reject scan documents whose identity is already stored.</li>
 *   <li>Cascade host removal to scan documents no host references any more.</li>
 * </ul>
 * <p><strong>Observability:</strong> Logs stored scans and cascaded removals at DEBUG.</p>
 *
 * @since 0.1.0
 */
public class ScanResultService extends ActiveQueryService {
  private static final Logger log = LoggerFactory.getLogger(ScanResultService.class);

  private final Supplier<? extends DocumentStorePort> scansFactory;
  private DocumentStorePort scans;

  /**
   * Creates the service.
   *
   * @param hostsFactory opens the host collection
   * @param scansFactory opens the scan document collection
   * @param metrics metrics sink, {@code null} for none
   * @param clock time source, {@code null} for the system clock
   */
  public ScanResultService(Supplier<? extends DocumentStorePort> hostsFactory,
      Supplier<? extends DocumentStorePort> scansFactory, MetricsPort metrics, ClockPort clock) {
    super("hosts", hostsFactory, metrics, clock);
    this.scansFactory = Objects.requireNonNull(scansFactory, "scansFactory");
  }

  private synchronized DocumentStorePort scans() {
    if (scans == null) {
      scans = Objects.requireNonNull(scansFactory.get(), "scansFactory returned null");
    }
    return scans;
  }

  @Override
  public synchronized void invalidateCache() {
    super.invalidateCache();
    if (scans != null) {
      scans.close();
      scans = null;
    }
  }

  @Override
  public void init() {
    super.init();
    scans().purge();
  }

  @Override
  public void storeOrMergeHost(Map<String, Object> host) {
    storeHost(host);
  }

  /**
   * Stores a scan document.
   *
   * @param scan document carrying its identity under {@code _id}
   * @return identity of the stored document
   * @throws DuplicateKeyException when a scan with the same identity is already stored
   */
  public Object storeScanDoc(Map<String, Object> scan) {
    Objects.requireNonNull(scan, "scan");
    Object id = scan.get(Records.ID);
    if (id != null && isScanPresent(id)) {
      throw new DuplicateKeyException(id);
    }
    Object stored = scans().insert(scan);
    log.debug("Scan stored: {}", stored);
    return stored;
  }

  /**
   * Loads a scan document.
   *
   * @param scanId scan identity
   * @return document, or {@code null} when unknown
   */
  public Map<String, Object> getScan(Object scanId) {
    List<Map<String, Object>> found = scans().search(Filters.eq(Records.ID, scanId));
    return found.isEmpty() ? null : found.get(0);
  }

  public boolean isScanPresent(Object scanId) {
    return scans().count(Filters.eq(Records.ID, scanId)) > 0;
  }

  /**
   * Removes a host, then every scan document it referenced that no remaining host references.
   *
   * @param recordOrId host record or its identity
   */
  @Override
  public void remove(Object recordOrId) {
    Object id = idOf(recordOrId);
    List<Map<String, Object>> hosts = store().search(Filters.eq(Records.ID, id));
    store().remove(Filters.eq(Records.ID, id));
    for (Map<String, Object> host : hosts) {
      for (Object scanId : getScanIds(host)) {
        Filter referencing = Filters.contains("scanid", scanId);
        if (store().count(referencing) == 0) {
          scans().remove(Filters.eq(Records.ID, scanId));
          log.debug("Removed unreferenced scan {}", scanId);
        }
      }
    }
  }
}
