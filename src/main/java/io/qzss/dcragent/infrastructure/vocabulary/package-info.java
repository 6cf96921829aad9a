/**
 * Legal locality values used to validate configured filter keywords.
 */
package io.qzss.dcragent.infrastructure.vocabulary;
