package com.sams.authservice.service;

import com.sams.authservice.exception.UserNotFoundException;
import com.sams.authservice.exception.ValidationException;
import com.sams.authservice.model.Role;
import com.sams.authservice.model.User;
import com.sams.authservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Administrative changes to role and active status. Takes effect on the next request of the user. */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<User> findAll() {
        return userRepository.findAll();
    }

    @Transactional
    public User setActive(Long id, boolean active) {
        User user = getUser(id);
        user.setActive(active);
        log.info("User {} {}", user.getEmail(), active ? "activated" : "deactivated");
        return userRepository.save(user);
    }

    @Transactional
    public User changeRole(Long id, String roleValue) {
        Role role;
        try {
            role = Role.fromValue(roleValue);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("role", e.getMessage());
        }
        User user = getUser(id);
        user.setRole(role);
        log.info("User {} role changed to {}", user.getEmail(), role.getValue());
        return userRepository.save(user);
    }

    private User getUser(Long id) {
        return userRepository.findById(id).orElseThrow(() -> new UserNotFoundException(id));
    }
}
