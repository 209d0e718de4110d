package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface EntityLabelRepository extends MongoRepository<EntityLabel, String> {

    List<EntityLabel> findByAddress(String address);
}
