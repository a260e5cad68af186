package com.contactsbook.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.contactsbook.backend.modules.auth.domain.AppUser;
import com.contactsbook.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.contactsbook.backend.support.InMemorySessionCache;
import com.contactsbook.backend.support.MutableClock;
import com.contactsbook.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.AnnotationTransactionAttributeSource;
import org.springframework.transaction.interceptor.TransactionInterceptor;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;

/**
 * Runs {@link AuthService} behind the same transaction advice Spring applies, with a transaction
 * manager whose database is down.
 */
@ExtendWith(MockitoExtension.class)
class AuthServiceTransactionBoundaryTest {

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private RefreshTokenStore refreshTokenStore;

    @Mock
    private AvatarLookup avatarLookup;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private InMemorySessionCache sessionCache;
    private JwtTokenService jwtTokenService;
    private UnreachableDatabaseTransactionManager transactionManager;
    private AuthService transactionalAuthService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        sessionCache = new InMemorySessionCache(clock);
        jwtTokenService = new JwtTokenService(new JwtTokenProvider(JwtTokenServiceTest.SECRET, "HS256"), 15, 7, clock);
        AuthService target = new AuthService(
                userDirectory,
                refreshTokenStore,
                new PasswordHasher(new BCryptPasswordEncoder(4)),
                new TokenHasher(),
                jwtTokenService,
                sessionCache,
                avatarLookup,
                notificationDispatcher,
                clock,
                Duration.ofHours(1),
                DenylistFailurePolicy.FAIL_OPEN
        );

        transactionManager = new UnreachableDatabaseTransactionManager();
        ProxyFactory proxyFactory = new ProxyFactory(target);
        proxyFactory.setProxyTargetClass(true);
        proxyFactory.addAdvice(new TransactionInterceptor(transactionManager, new AnnotationTransactionAttributeSource()));
        transactionalAuthService = (AuthService) proxyFactory.getProxy();
    }

    @Test
    void cachedUserValidatesWithoutBeginningTransaction() {
        AppUser alice = TestUsers.user(1L, "alice", "alice@example.com", "hash", true);
        sessionCache.putUserSnapshot(UserSnapshot.from(alice), Duration.ofHours(1));
        String token = jwtTokenService.issueAccessToken("alice");

        UserSnapshot snapshot = transactionalAuthService.validateAccessToken(token);

        assertThat(snapshot.username()).isEqualTo("alice");
        assertThat(transactionManager.begins).isZero();
        verifyNoInteractions(userDirectory);
    }

    @Test
    void cacheMissReadsThroughDirectoryWithoutOuterTransaction() {
        AppUser alice = TestUsers.user(1L, "alice", "alice@example.com", "hash", true);
        when(userDirectory.findByUsername("alice")).thenReturn(Optional.of(alice));
        String token = jwtTokenService.issueAccessToken("alice");

        assertThat(transactionalAuthService.validateAccessToken(token).id()).isEqualTo(1L);
        assertThat(transactionManager.begins).isZero();
    }

    @Test
    void transactionalOperationsStillRequireTheDatabase() {
        assertThatThrownBy(() -> transactionalAuthService.revokeRefreshToken("some-refresh-token"))
                .isInstanceOf(CannotCreateTransactionException.class);
        assertThat(transactionManager.begins).isEqualTo(1);
    }

    private static final class UnreachableDatabaseTransactionManager extends AbstractPlatformTransactionManager {

        private int begins;

        @Override
        protected Object doGetTransaction() {
            return new Object();
        }

        @Override
        protected void doBegin(Object transaction, TransactionDefinition definition) {
            begins++;
            throw new CannotCreateTransactionException("database unreachable");
        }

        @Override
        protected void doCommit(DefaultTransactionStatus status) {
        }

        @Override
        protected void doRollback(DefaultTransactionStatus status) {
        }
    }
}
