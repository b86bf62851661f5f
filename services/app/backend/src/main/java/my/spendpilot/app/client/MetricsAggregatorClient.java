package my.spendpilot.app.client;

import my.spendpilot.app.model.TenantSnapshot;

public interface MetricsAggregatorClient {
	/**
	 * Fresh windowed metrics, units, directions and creative assets for one tenant.
	 */
	TenantSnapshot fetchSnapshot(String tenantId);
}
