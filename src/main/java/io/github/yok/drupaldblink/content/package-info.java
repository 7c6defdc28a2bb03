/**
 * Drupal entity lookups (nodes, taxonomy, users, paragraphs) built on the query executor.
 */
package io.github.yok.drupaldblink.content;
