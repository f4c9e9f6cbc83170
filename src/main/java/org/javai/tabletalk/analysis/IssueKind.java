package org.javai.tabletalk.analysis;

public enum IssueKind {

	TYPE_MISMATCH,
	NAMING_INCONSISTENCY,
	ABBREVIATION,
	CONCEPT_TYPE_MISMATCH;

	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
