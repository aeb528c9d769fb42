package com.componenttracker.controller;

import com.componenttracker.dto.ErrorResponse;
import com.componenttracker.service.FatalDecodeException;
import com.componenttracker.service.PayloadTooLargeException;
import com.componenttracker.service.UnsupportedPayloadFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(FatalDecodeException.class)
    public ResponseEntity<ErrorResponse> handleDecodeFailure(FatalDecodeException ex) {
        logger.warn("Upload rejected, payload could not be decoded: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("DECODE_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(UnsupportedPayloadFormatException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedFormat(UnsupportedPayloadFormatException ex) {
        logger.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("UNSUPPORTED_FORMAT", ex.getMessage()));
    }

    @ExceptionHandler(ComponentUploadController.EmptyUploadException.class)
    public ResponseEntity<ErrorResponse> handleEmptyUpload(ComponentUploadController.EmptyUploadException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("EMPTY_FILE", ex.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingFile(MissingServletRequestPartException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("NO_FILE", "No file provided"));
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(PayloadTooLargeException ex) {
        logger.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ErrorResponse.of("PAYLOAD_TOO_LARGE", ex.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMultipartTooLarge(MaxUploadSizeExceededException ex) {
        logger.warn("Multipart upload rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ErrorResponse.of("PAYLOAD_TOO_LARGE", "File exceeds the upload size limit"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred"));
    }
}
