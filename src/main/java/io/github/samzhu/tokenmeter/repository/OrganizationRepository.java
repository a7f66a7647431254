package io.github.samzhu.tokenmeter.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.tokenmeter.document.Organization;

public interface OrganizationRepository extends MongoRepository<Organization, String> {
}
