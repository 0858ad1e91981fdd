package com.tony.cfbRankings.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.net.URI;

/**
 * Traduit les refus du moteur en application/problem+json. La propriété "reason"
 * nomme la règle violée.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String PROBLEM_BASE = "urn:cfb-rankings:problem:";

    @ExceptionHandler(InvalidGameException.class)
    public ProblemDetail handleInvalidGame(InvalidGameException ex) {
        HttpStatus status = ex.getReason() == InvalidGameException.Reason.ALREADY_PROCESSED
                ? HttpStatus.CONFLICT
                : HttpStatus.UNPROCESSABLE_ENTITY;
        ProblemDetail pd = problem(status, "Invalid Game", ex.getMessage(), ex.getReason().name());
        pd.setProperty("gameId", ex.getGameId());
        return pd;
    }

    @ExceptionHandler(OutOfOrderProcessingException.class)
    public ProblemDetail handleOutOfOrder(OutOfOrderProcessingException ex) {
        ProblemDetail pd = problem(HttpStatus.CONFLICT, "Out Of Order Processing", ex.getMessage(), "OUT_OF_ORDER");
        pd.setProperty("gameId", ex.getGameId());
        pd.setProperty("teamId", ex.getTeamId());
        pd.setProperty("latestProcessedGameId", ex.getLatestProcessedGameId());
        return pd;
    }

    @ExceptionHandler(AlreadyPredictedException.class)
    public ProblemDetail handleAlreadyPredicted(AlreadyPredictedException ex) {
        ProblemDetail pd = problem(HttpStatus.CONFLICT, "Already Predicted", ex.getMessage(), "ALREADY_PREDICTED");
        pd.setProperty("gameId", ex.getGameId());
        return pd;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail handleNotFound(ResourceNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Resource Not Found", ex.getMessage(), "NOT_FOUND");
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, HandlerMethodValidationException.class,
            MissingServletRequestPartException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), "BAD_REQUEST");
    }

    // Le reste : 500 sans fuite de détails internes
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("❌ Erreur inattendue", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "Unexpected error, see server logs.", "INTERNAL_ERROR");
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail, String reason) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setType(URI.create(PROBLEM_BASE + reason.toLowerCase().replace('_', '-')));
        pd.setTitle(title);
        pd.setProperty("reason", reason);
        return pd;
    }
}
