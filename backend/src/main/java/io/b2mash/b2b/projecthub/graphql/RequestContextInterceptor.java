package io.b2mash.b2b.projecthub.graphql;

import io.b2mash.b2b.projecthub.multitenancy.RequestContext;
import io.b2mash.b2b.projecthub.multitenancy.RequestContextFactory;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.server.WebGraphQlInterceptor;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Creates the {@link RequestContext} for each GraphQL request from its headers and places it in the
 * GraphQL context, where data fetchers receive it via {@code @ContextValue}.
 */
@Component
public class RequestContextInterceptor implements WebGraphQlInterceptor {

  private static final Logger log = LoggerFactory.getLogger(RequestContextInterceptor.class);

  private final RequestContextFactory requestContextFactory;

  public RequestContextInterceptor(RequestContextFactory requestContextFactory) {
    this.requestContextFactory = requestContextFactory;
  }

  @Override
  public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
    var headers = request.getHeaders();
    var context =
        requestContextFactory.create(
            headers.getFirst(RequestContextFactory.AUTHORIZATION_HEADER),
            headers.getFirst(RequestContextFactory.ORGANIZATION_HEADER));
    request.configureExecutionInput(
        (executionInput, builder) ->
            builder.graphQLContext(Map.of(RequestContext.CONTEXT_KEY, context)).build());
    log.debug("GraphQL operation {} ({})", request.getOperationName(), request.getId());
    return chain.next(request);
  }
}
