package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CompletionException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("SESSION_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(NoDocumentException.class)
    public ResponseEntity<ErrorResponse> handleNoDocument(NoDocumentException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("NO_DOCUMENT", e.getMessage()));
    }

    @ExceptionHandler(DocumentValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidDocument(DocumentValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_DOCUMENT", e.getMessage()));
    }

    @ExceptionHandler(DocumentUnreadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(DocumentUnreadableException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("DOCUMENT_UNREADABLE", e.getMessage()));
    }

    @ExceptionHandler(UsageLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleUsageLimit(UsageLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(new ErrorResponse("USAGE_LIMIT_REACHED", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgument(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("INVALID_STATE", e.getMessage()));
    }

    // 异步编辑抛出的业务异常被 CompletionException 包裹，拆开后按原类型处理
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ErrorResponse> handleCompletion(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof SessionNotFoundException snf) return handleSessionNotFound(snf);
        if (cause instanceof NoDocumentException nd) return handleNoDocument(nd);
        if (cause instanceof DocumentValidationException dv) return handleInvalidDocument(dv);
        if (cause instanceof DocumentUnreadableException du) return handleUnreadable(du);
        if (cause instanceof UsageLimitExceededException ul) return handleUsageLimit(ul);
        if (cause instanceof IllegalArgumentException ia) return handleIllegalArgument(ia);
        if (cause instanceof IllegalStateException is) return handleIllegalState(is);
        return handleUnexpected(cause instanceof Exception ex ? ex : e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An error occurred while processing the document. Please try again."));
    }
}
