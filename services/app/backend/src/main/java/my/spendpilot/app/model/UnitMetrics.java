package my.spendpilot.app.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record UnitMetrics(
		String unitId,
		Map<WindowKey, MetricsWindow> windows,
		List<SubComponentSpend> subComponents
) {
	public UnitMetrics {
		windows = windows == null || windows.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(windows));
		subComponents = subComponents == null ? List.of() : List.copyOf(subComponents);
	}

	public MetricsWindow window(WindowKey key) {
		MetricsWindow window = windows.get(key);
		return window == null ? MetricsWindow.empty() : window;
	}

	public boolean hasAnySpend() {
		return windows.values().stream().anyMatch(window -> window.spendCents() > 0);
	}
}
