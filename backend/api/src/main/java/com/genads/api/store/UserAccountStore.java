package com.genads.api.store;

import com.genads.api.entity.User;
import com.genads.api.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Owns the "one account per email" rule for {@link RecordCollection#USER}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserAccountStore {

    private final RecordStore recordStore;
    private final UserMapper userMapper;

    /**
     * Inserts the user under a new id unless the email is already registered.
     * Lookup and insert are separate statements, so two concurrent signups
     * with one email can both succeed.
     *
     * @return the stored user, or empty if the email is taken
     */
    public Optional<User> insertIfEmailAbsent(User user) {
        if (userMapper.findByEmail(user.getEmail()).isPresent()) {
            return Optional.empty();
        }

        LocalDateTime now = recordStore.now();
        User stored = user.toBuilder()
                .id(recordStore.newId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        userMapper.insert(stored);
        log.debug("[UserAccountStore] Inserted user {} into {}", stored.getId(), RecordCollection.USER.getTableName());
        return Optional.of(stored);
    }

    public Optional<User> findByEmail(String email) {
        return userMapper.findByEmail(email);
    }
}
