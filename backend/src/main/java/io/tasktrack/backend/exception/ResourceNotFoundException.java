package io.tasktrack.backend.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A time entry, task or project that the request names does not exist. Rendered as a 404 problem
 * whose title names the kind of resource, e.g. {@code "TimeEntry not found"}.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    this(
        resourceType + " not found",
        "No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id);
  }

  private ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(title, detail), null);
  }

  /** For lookups that are not by id, such as "no running timer on this task". */
  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
