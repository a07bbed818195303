package com.medassist.guideline;

public record FreeTextTag(String tag) implements ConditionClause {

    @Override
    public boolean isStructured() {
        return false;
    }

    @Override
    public String describe() {
        return tag;
    }
}
