package io.github.samzhu.tokenmeter.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.tokenmeter.document.UserProfile;

public interface UserProfileRepository extends MongoRepository<UserProfile, String> {

    List<UserProfile> findByOrganizationId(String organizationId);
}
