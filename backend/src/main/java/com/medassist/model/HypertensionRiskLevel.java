package com.medassist.model;

public enum HypertensionRiskLevel implements RiskGrade {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    VERY_HIGH("very-high");

    private final String label;

    HypertensionRiskLevel(String label) {
        this.label = label;
    }

    @Override
    public int rank() {
        return ordinal();
    }

    @Override
    public String label() {
        return label;
    }

    public HypertensionRiskLevel max(HypertensionRiskLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
