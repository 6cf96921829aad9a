/**
 * SMTP submission via Jakarta Mail.
 */
package io.qzss.dcragent.infrastructure.mail;
