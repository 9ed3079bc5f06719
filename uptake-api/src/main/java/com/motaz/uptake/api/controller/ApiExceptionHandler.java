package com.motaz.uptake.api.controller;

import com.motaz.uptake.api.services.UnknownCohortException;
import com.motaz.uptake.core.exception.DataNotFoundException;
import com.motaz.uptake.core.exception.ForecastAlignmentException;
import com.motaz.uptake.core.exception.InsufficientDataException;
import com.motaz.uptake.core.exception.UndefinedDeviationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DataNotFoundException.class)
    public ProblemDetail handleNotFound(DataNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({UnknownCohortException.class, IllegalArgumentException.class})
    public ProblemDetail handleBadRequest(RuntimeException e) {
        log.warn("Bad request: {}", e.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({InsufficientDataException.class, UndefinedDeviationException.class})
    public ProblemDetail handleUnprocessable(RuntimeException e) {
        log.warn("Cohort cannot be analysed: {}", e.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(ForecastAlignmentException.class)
    public ProblemDetail handleAlignment(ForecastAlignmentException e) {
        log.error("Forecast does not cover observed date {}", e.getDate(), e);
        return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal forecasting error");
    }
}
