/**
 * Error taxonomy package.
 *
 * <p>All business failures extend {@link com.ryuqq.srp.core.exception.SrpException},
 * an unchecked exception carrying a {@link com.ryuqq.srp.core.exception.SrpErrorCode}.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.srp.core.exception.ValidationException} - A field violates a rule (SRP-400)</li>
 *   <li>{@link com.ryuqq.srp.core.exception.NotFoundException} - Unknown identifier (SRP-404)</li>
 *   <li>{@link com.ryuqq.srp.core.exception.UnsupportedFormatException} - Unknown format tag (SRP-415)</li>
 * </ul>
 *
 * <p>Missing records and unsupported formats are always reported with distinct kinds.
 * Null arguments and other programming errors are reported with
 * {@link java.lang.IllegalArgumentException}, not with this taxonomy.</p>
 *
 * @since 1.0.0
 * @author SRP Team
 */
package com.ryuqq.srp.core.exception;
