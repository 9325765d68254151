package com.budgetme.goals.services.contributions.orchestrator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.budgetme.goals.config.ContributionProperties;
import com.budgetme.goals.exceptions.ResourceNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Sessões de contribuição em memória. Sessões ociosas além do TTL são
 * removidas na próxima consulta ao registro.
 */
@Slf4j
@Component
public class ContributionSessionRegistry {

    private final Map<UUID, ContributionSession> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public ContributionSessionRegistry(ContributionProperties properties) {
        this(properties.sessionTtl(), Clock.systemUTC());
    }

    ContributionSessionRegistry(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public ContributionSession create(UUID userId) {
        evictExpired();
        ContributionSession session = new ContributionSession(UUID.randomUUID(), userId, clock.instant());
        sessions.put(session.getId(), session);
        return session;
    }

    /**
     * Sessão do usuário. Sessão inexistente, expirada ou de outro usuário
     * resulta no mesmo 404.
     */
    public ContributionSession get(UUID userId, UUID sessionId) {
        evictExpired();
        ContributionSession session = sessions.get(sessionId);
        if (session == null || !session.getUserId().equals(userId)) {
            throw new ResourceNotFoundException("Sessão de contribuição não encontrada");
        }
        session.touch(clock.instant());
        return session;
    }

    public void remove(UUID sessionId) {
        sessions.remove(sessionId);
    }

    public int size() {
        return sessions.size();
    }

    void evictExpired() {
        Instant now = clock.instant();
        sessions.values().removeIf(session -> {
            boolean expired = session.isExpired(now, ttl);
            if (expired) {
                log.debug("[ContributionFlow] Sessão {} expirada", session.getId());
            }
            return expired;
        });
    }
}
