package io.b2mash.b2b.projecthub.graphql;

import graphql.GraphQLContext;
import graphql.execution.CoercedVariables;
import graphql.language.Value;
import graphql.scalars.ExtendedScalars;
import graphql.schema.Coercing;
import graphql.schema.CoercingParseLiteralException;
import graphql.schema.CoercingParseValueException;
import graphql.schema.CoercingSerializeException;
import graphql.schema.GraphQLScalarType;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.graphql.execution.RuntimeWiringConfigurer;

/**
 * Registers the {@code Date} and {@code DateTime} scalars. Entities keep timestamps as {@link
 * Instant}, which the stock {@code DateTime} scalar does not serialize, so it is wrapped to convert
 * to UTC {@link OffsetDateTime} first.
 */
@Configuration
public class ScalarConfig {

  static final GraphQLScalarType DATE_TIME =
      GraphQLScalarType.newScalar(ExtendedScalars.DateTime)
          .coercing(new InstantAwareCoercing(ExtendedScalars.DateTime.getCoercing()))
          .build();

  @Bean
  public RuntimeWiringConfigurer scalarWiringConfigurer() {
    return wiring -> wiring.scalar(ExtendedScalars.Date).scalar(DATE_TIME);
  }

  static final class InstantAwareCoercing implements Coercing<Object, Object> {

    private final Coercing<?, ?> delegate;

    InstantAwareCoercing(Coercing<?, ?> delegate) {
      this.delegate = delegate;
    }

    @Override
    public Object serialize(Object dataFetcherResult, GraphQLContext context, Locale locale)
        throws CoercingSerializeException {
      Object value =
          dataFetcherResult instanceof Instant instant
              ? instant.atOffset(ZoneOffset.UTC)
              : dataFetcherResult;
      return delegate.serialize(value, context, locale);
    }

    @Override
    public Object parseValue(Object input, GraphQLContext context, Locale locale)
        throws CoercingParseValueException {
      return delegate.parseValue(input, context, locale);
    }

    @Override
    public Object parseLiteral(
        Value<?> input, CoercedVariables variables, GraphQLContext context, Locale locale)
        throws CoercingParseLiteralException {
      return delegate.parseLiteral(input, variables, context, locale);
    }

    @Override
    public Value<?> valueToLiteral(Object input, GraphQLContext context, Locale locale) {
      return delegate.valueToLiteral(input, context, locale);
    }
  }
}
