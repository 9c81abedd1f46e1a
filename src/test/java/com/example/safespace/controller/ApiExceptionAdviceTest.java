package com.example.safespace.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.safespace.response.ApiError;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.UUID;

class ApiExceptionAdviceTest {

  private final ApiExceptionAdvice advice = new ApiExceptionAdvice();

  @Test
  void malformedSessionIdIsUnprocessable() {
    MethodArgumentTypeMismatchException ex = new MethodArgumentTypeMismatchException(
        "not-a-uuid", UUID.class, "sessionId", mock(MethodParameter.class), new IllegalArgumentException("Invalid UUID"));

    ResponseEntity<ApiError> response = advice.handleTypeMismatch(ex);

    assertThat(response.getStatusCode().value()).isEqualTo(422);
    assertThat(response.getBody().getDetails()).containsExactly("sessionId has an invalid value 'not-a-uuid'");
  }

  @Test
  void unreadableBodyIsUnprocessable() {
    HttpMessageNotReadableException ex = new HttpMessageNotReadableException("JSON parse error", mock(HttpInputMessage.class));

    ResponseEntity<ApiError> response = advice.handleUnreadableBody(ex);

    assertThat(response.getStatusCode().value()).isEqualTo(422);
    assertThat(response.getBody().getError()).isEqualTo("validation_error");
    assertThat(response.getBody().getDetails()).isNull();
  }
}
