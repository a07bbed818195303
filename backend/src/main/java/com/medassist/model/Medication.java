package com.medassist.model;

import java.time.LocalDate;

public record Medication(String name, DrugClass drugClass, String dose, LocalDate startDate, boolean insulin) {
}
