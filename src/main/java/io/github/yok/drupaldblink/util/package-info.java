/**
 * Utility package for DrupalDBLink.
 *
 * <p>
 * Provides identifier validation for SQL that cannot be parameterized, credential masking for log
 * output, and fatal error reporting.
 * </p>
 */
package io.github.yok.drupaldblink.util;
