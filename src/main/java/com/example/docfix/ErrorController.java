package com.example.docfix;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

/** 未进入 @RestControllerAdvice 的错误（过滤器、multipart 解析等）在这里兜底 */
@Slf4j
@Controller
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    @RequestMapping("/error")
    @ResponseBody
    public ResponseEntity<ErrorResponse> handleError(HttpServletRequest request) {
        Integer statusCode = (Integer) request.getAttribute("jakarta.servlet.error.status_code");
        String errorMessage = (String) request.getAttribute("jakarta.servlet.error.message");
        Throwable exception = (Throwable) request.getAttribute("jakarta.servlet.error.exception");

        int status = statusCode != null ? statusCode : 500;
        String message = (errorMessage != null && !errorMessage.isBlank()) ? errorMessage : "An unexpected error occurred";

        if (exception != null) {
            log.error("request {} failed with status {}", request.getAttribute("jakarta.servlet.error.request_uri"), status, exception);
        } else {
            log.warn("request {} failed with status {}: {}", request.getAttribute("jakarta.servlet.error.request_uri"), status, message);
        }
        return ResponseEntity.status(status).body(new ErrorResponse(status >= 500 ? "INTERNAL_ERROR" : "REQUEST_ERROR", message));
    }
}
