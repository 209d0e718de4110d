package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface WatchlistEntryRepository extends MongoRepository<WatchlistEntry, String> {

    List<WatchlistEntry> findByAddress(String address);
}
