package my.spendpilot.app.client;

import my.spendpilot.app.model.RiskSignal;

import java.util.List;

public interface RiskSignalClient {
	List<RiskSignal> fetchSignals(String tenantId);
}
