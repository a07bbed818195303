package com.medassist.model;

public record DiagnosisCandidate(String name, double likelihood) {
}
