package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Address on a named watchlist (e.g. OFAC SDN). Every entry counts as sanctioned for scoring.
 */
@Document(collection = "watchlist_entries")
@CompoundIndex(name = "list_address", def = "{'listName': 1, 'address': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WatchlistEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String listName;
    private String address;
    private String entityName;
    private String sdnId;
    private String program;
    private Instant addedAt;
}
