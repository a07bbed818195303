package com.medassist.model;

public enum DiabetesControlStatus implements RiskGrade {
    GOOD("good"),
    FAIR("fair"),
    POOR("poor");

    private final String label;

    DiabetesControlStatus(String label) {
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

    /**
     * One band worse. POOR stays POOR.
     */
    public DiabetesControlStatus escalate() {
        return switch (this) {
            case GOOD -> FAIR;
            case FAIR, POOR -> POOR;
        };
    }
}
