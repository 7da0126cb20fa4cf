/**
 * Logging infrastructure.
 *
 * <p>{@link com.phillippitts.shato.config.logging.CorrelationIdFilter} stamps every request with a
 * correlation id. Log4j2 renders it through {@code %X{correlationId}} in log4j2-spring.xml.
 */
package com.phillippitts.shato.config.logging;
