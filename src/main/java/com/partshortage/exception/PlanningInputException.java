package com.partshortage.exception;

/** A run cannot start: a required input stream is missing or a parameter is out of range. */
public class PlanningInputException extends PartShortageException {
    public PlanningInputException(String message) {
        super("PLANNING_INPUT_ERROR", message);
    }
}
