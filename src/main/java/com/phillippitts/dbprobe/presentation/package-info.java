/**
 * Presentation layer (REST controllers and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - {@code /} and {@code /health}</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers receive the {@link com.phillippitts.dbprobe.domain.RequestContext} as a
 * method argument and pass it on explicitly; they never look it up.
 *
 * @see com.phillippitts.dbprobe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.dbprobe.presentation;
