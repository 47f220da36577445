package com.pairup.server.im.web;

import com.pairup.server.im.exception.ErrorKind;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MessagingException.class)
    public ResponseEntity<ErrorResponse> handleMessaging(MessagingException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed ({})", e.getKind(), e);
        } else {
            log.info("Request rejected ({}): {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getKind().name(), e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorKind.INVALID_REQUEST.name(), "invalid request: " + e.getMessage()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case NOT_PARTICIPANT:
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case FORBIDDEN:
                return HttpStatus.FORBIDDEN;
            case DUPLICATE_ID:
                return HttpStatus.CONFLICT;
            case SELF_CHAT:
            case INVALID_REACTION_CODE:
            case INVALID_REQUEST:
            case MALFORMED_FRAME:
            case UNKNOWN_EVENT:
                return HttpStatus.BAD_REQUEST;
            case STORE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case PUSH_FAILED:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
