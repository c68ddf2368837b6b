package com.brandmetrics.backend.controller;

import com.brandmetrics.backend.model.ErrorResponse;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

/**
 * JSON body for errors raised outside the controllers (unmapped paths, container errors).
 */
@RestController
public class CustomErrorController implements ErrorController {

    @RequestMapping(value = "/error", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ErrorResponse> handleError(HttpServletRequest request) {
        Object status = request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE);
        int statusCode = status != null ? Integer.parseInt(status.toString()) : HttpStatus.NOT_FOUND.value();
        HttpStatus httpStatus = HttpStatus.resolve(statusCode);
        if (httpStatus == null) {
            httpStatus = HttpStatus.INTERNAL_SERVER_ERROR;
        }

        Object uri = request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);
        String message = httpStatus == HttpStatus.NOT_FOUND
                ? "No endpoint here. Try POST /api/v1/refresh, GET /api/v1/metrics or GET /health."
                : "Request failed.";

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(httpStatus.value())
                .error(httpStatus.getReasonPhrase())
                .message(message)
                .path(uri != null ? uri.toString() : request.getRequestURI())
                .build();

        return new ResponseEntity<>(error, httpStatus);
    }
}
