package ch.so.arp.faq.bot;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for FAQ requests.
 */
public record FaqRequest(@NotBlank String question) {
}
