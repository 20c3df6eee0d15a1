package ch.rps.rpsbackend.web.api.dto;

/**
 * Request DTO for quick match.
 *
 * <p>Authentication is handled upstream; the caller passes the authenticated account id.
 *
 * @param accountId account asking to be matched
 */
public record QuickMatchRequest(
        Long accountId
) {}
