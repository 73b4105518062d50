package com.cohort.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A team or aide row: the human-facing container of a lead and its subordinates.
 *
 * @param owner     discriminated team/aide identity
 * @param userId    the user this team or aide works for
 * @param name      display name
 * @param mission   free-text purpose handed to the lead at bootstrap
 * @param status    lifecycle status
 * @param createdAt creation time
 */
public record OwnerRecord(
    Owner owner,
    String userId,
    String name,
    String mission,
    OwnerStatus status,
    Instant createdAt
) implements Serializable {}
