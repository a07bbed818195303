package com.medassist.exception;

import com.medassist.service.PlanReviewState;

public class IllegalPlanTransitionException extends RuntimeException {

    public IllegalPlanTransitionException(PlanReviewState from, PlanReviewState to) {
        super("Illegal plan transition: " + from + " -> " + to);
    }
}
