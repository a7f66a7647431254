package io.github.samzhu.tokenmeter.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.tokenmeter.document.Team;

public interface TeamRepository extends MongoRepository<Team, String> {

    List<Team> findByOrganizationId(String organizationId);
}
