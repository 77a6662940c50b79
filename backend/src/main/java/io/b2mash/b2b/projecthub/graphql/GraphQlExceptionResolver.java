package io.b2mash.b2b.projecthub.graphql;

import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;
import org.springframework.web.ErrorResponseException;

/**
 * Maps {@link ErrorResponseException}s to GraphQL errors. The problem's {@code code} property
 * becomes {@code extensions.code}; the HTTP status picks the error classification.
 */
@Component
public class GraphQlExceptionResolver extends DataFetcherExceptionResolverAdapter {

  private static final Logger log = LoggerFactory.getLogger(GraphQlExceptionResolver.class);

  @Override
  protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
    if (ex instanceof ErrorResponseException errorResponse) {
      var problem = errorResponse.getBody();
      var extensions = new LinkedHashMap<String, Object>();
      if (problem.getProperties() != null) {
        extensions.putAll(problem.getProperties());
      }
      int status = errorResponse.getStatusCode().value();
      if (status < 500) {
        log.warn(
            "GraphQL {} failed: status={}, code={}, reason={}",
            env.getField().getName(),
            status,
            extensions.get("code"),
            problem.getDetail());
      }
      return GraphqlErrorBuilder.newError(env)
          .errorType(errorType(status))
          .message(problem.getDetail() != null ? problem.getDetail() : problem.getTitle())
          .extensions(extensions)
          .build();
    }

    log.error("Unhandled error in GraphQL field {}", env.getField().getName(), ex);
    return GraphqlErrorBuilder.newError(env)
        .errorType(ErrorType.INTERNAL_ERROR)
        .message("Internal server error")
        .extensions(Map.of("code", "INTERNAL_ERROR"))
        .build();
  }

  static ErrorType errorType(int status) {
    return switch (status) {
      case 400 -> ErrorType.BAD_REQUEST;
      case 401 -> ErrorType.UNAUTHORIZED;
      case 403 -> ErrorType.FORBIDDEN;
      case 404 -> ErrorType.NOT_FOUND;
      default -> ErrorType.INTERNAL_ERROR;
    };
  }
}
