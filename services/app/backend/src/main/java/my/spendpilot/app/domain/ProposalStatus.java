package my.spendpilot.app.domain;

public enum ProposalStatus {
	PENDING,
	APPROVED,
	REJECTED,
	EXPIRED
}
