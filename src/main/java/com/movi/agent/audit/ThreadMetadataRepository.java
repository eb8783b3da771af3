package com.movi.agent.audit;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ThreadMetadataRepository extends MongoRepository<ThreadMetadata, String> {

    List<ThreadMetadata> findTop20ByOrderByUpdatedAtDesc();

}
