package ca.gc.cra.recon.application.query;

import ca.gc.cra.recon.application.port.ClockPort;
import ca.gc.cra.recon.application.port.DocumentStorePort;
import ca.gc.cra.recon.application.port.HostMergePort;
import ca.gc.cra.recon.application.port.MetricsPort;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Host collection holding one consolidated record per address.
 *
 * <p>Incoming hosts are offered to a {@link HostMergePort} first and stored only when no existing record
 * absorbed them.</p>
 *
 * @since 0.1.0
 */
public class ViewService extends ActiveQueryService {
  private final HostMergePort merger;

  public ViewService(Supplier<? extends DocumentStorePort> storeFactory, HostMergePort merger,
      MetricsPort metrics, ClockPort clock) {
    super("views", storeFactory, metrics, clock);
    this.merger = merger == null ? HostMergePort.NEVER : merger;
  }

  @Override
  public void storeOrMergeHost(Map<String, Object> host) {
    Objects.requireNonNull(host, "host");
    if (!merger.merge(host)) {
      storeHost(host);
    }
  }
}
