package com.factory.palletizer.config;

import com.factory.palletizer.exception.ActiveSetChangedException;
import com.factory.palletizer.exception.DuplicateDrumException;
import com.factory.palletizer.exception.GenerationNotAllowedException;
import com.factory.palletizer.exception.InvalidScanFormatException;
import com.factory.palletizer.exception.MaterialMismatchException;
import com.factory.palletizer.exception.MaterialNotFoundException;
import com.factory.palletizer.exception.MissingQuantityException;
import com.factory.palletizer.exception.PackingException;
import com.factory.palletizer.exception.PalletIdConflictException;
import com.factory.palletizer.exception.PalletNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({ InvalidScanFormatException.class, MissingQuantityException.class })
    public ProblemDetail handleInvalidInput(HttpServletRequest request, PackingException ex) {
        return problem(request, HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(DuplicateDrumException.class)
    public ProblemDetail handleDuplicate(HttpServletRequest request, DuplicateDrumException ex) {
        ProblemDetail problem = problem(request, HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
        problem.setProperty("drumNumber", ex.getDrumNumber());
        problem.setProperty("priorPalletId", ex.getPriorPalletId());
        problem.setProperty("priorCreatedAt", ex.getPriorCreatedAt());
        return problem;
    }

    @ExceptionHandler({ MaterialMismatchException.class, ActiveSetChangedException.class,
            PalletIdConflictException.class })
    public ProblemDetail handleConflict(HttpServletRequest request, PackingException ex) {
        return problem(request, HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(GenerationNotAllowedException.class)
    public ProblemDetail handleGenerationNotAllowed(HttpServletRequest request, GenerationNotAllowedException ex) {
        return problem(request, HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({ MaterialNotFoundException.class, PalletNotFoundException.class })
    public ProblemDetail handleNotFound(HttpServletRequest request, PackingException ex) {
        return problem(request, HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({ IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class })
    public ProblemDetail handleBadRequest(HttpServletRequest request, Exception ex) {
        return problem(request, HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    // Let Spring Security answer 403 instead of the catch-all below
    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(HttpServletRequest request, AccessDeniedException ex) {
        return problem(request, HttpStatus.FORBIDDEN, "FORBIDDEN", ex.getMessage());
    }

    @ExceptionHandler({ DataAccessException.class, TransactionException.class })
    public ProblemDetail handleBackend(HttpServletRequest request, Exception ex) {
        logger.error("Backend failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return problem(request, HttpStatus.SERVICE_UNAVAILABLE, "BACKEND_FAILURE",
                "The operation was not saved. Please try again.");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleException(HttpServletRequest request, Exception ex) {
        logger.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return problem(request, HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage());
    }

    private static ProblemDetail problem(HttpServletRequest request, HttpStatus status, String code, String message) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, message);
        problem.setInstance(URI.create(request.getRequestURI()));
        problem.setProperty("error", code);
        return problem;
    }
}
