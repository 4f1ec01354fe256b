package com.poufmaker.api.service;

import com.poufmaker.api.dto.UserSummaryDTO;
import com.poufmaker.api.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Batch lookup of the public user fields shown next to products, bids and conversations.
 */
@Service
@RequiredArgsConstructor
public class UserDirectoryService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public Map<UUID, UserSummaryDTO> findSummaries(Collection<UUID> userIds) {
        Set<UUID> ids = userIds.stream().filter(Objects::nonNull).collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Map.of();
        }
        return userRepository.findAllById(ids).stream()
                .map(UserSummaryDTO::fromEntity)
                .collect(Collectors.toMap(UserSummaryDTO::getId, Function.identity()));
    }
}
