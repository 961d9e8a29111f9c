package com.github.dimitryivaniuta.outreach.passes.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Request payload for issuing a pass to an attendee.
 *
 * @param tenantId tenant the caller acts for
 * @param platforms wallet platforms ({@code apple}, {@code google}); may be empty
 * @param source what triggered the request (enrollment, admin, ...)
 */
public record IssuePassRequest(
        @NotBlank String tenantId,
        @Size(max = 2) List<@NotBlank String> platforms,
        @Size(max = 64) String source
) {}
