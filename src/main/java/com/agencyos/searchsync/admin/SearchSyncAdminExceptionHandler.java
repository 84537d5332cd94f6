package com.agencyos.searchsync.admin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Error mapping for the admin API. Internal details stay in the server log.
 */
@RestControllerAdvice(assignableTypes = SearchSyncAdminController.class)
public class SearchSyncAdminExceptionHandler {

	private static final Logger log = LoggerFactory.getLogger(SearchSyncAdminExceptionHandler.class);

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
		return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<ApiError> invalid(MethodArgumentNotValidException e) {
		String detail = e.getBindingResult().getFieldErrors().stream()
				.map(fe -> fe.getField() + " " + fe.getDefaultMessage())
				.findFirst()
				.orElse("invalid request");
		return ResponseEntity.badRequest().body(new ApiError("bad_request", detail));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ApiError> internal(Exception e) {
		log.error("Search sync admin endpoint failure", e);
		return ResponseEntity.status(500).body(new ApiError("internal_error", "Request failed"));
	}

	public record ApiError(String code, String message) {
	}
}
