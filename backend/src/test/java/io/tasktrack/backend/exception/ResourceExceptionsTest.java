package io.tasktrack.backend.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ResourceExceptionsTest {

  @Test
  void notFound_namesResourceTypeAndId() {
    var id = UUID.randomUUID();

    var ex = new ResourceNotFoundException("TimeEntry", id);

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(ex.getBody().getTitle()).isEqualTo("TimeEntry not found");
    assertThat(ex.getBody().getDetail()).isEqualTo("No timeentry found with id " + id);
  }

  @Test
  void notFound_withDetailKeepsTitleAndDetailAsGiven() {
    var ex = ResourceNotFoundException.withDetail("No running timer", "Task 42 is idle");

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(ex.getBody().getTitle()).isEqualTo("No running timer");
    assertThat(ex.getBody().getDetail()).isEqualTo("Task 42 is idle");
  }

  @Test
  void conflict_isRetryable409AndKeepsCause() {
    var cause = new InterruptedException();

    var ex = new ResourceConflictException("Timer busy", "Timer on task 42 is busy", cause);

    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(ex.getBody().getTitle()).isEqualTo("Timer busy");
    assertThat(ex.getCause()).isSameAs(cause);
  }
}
