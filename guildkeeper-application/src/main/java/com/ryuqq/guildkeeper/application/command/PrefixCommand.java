package com.ryuqq.guildkeeper.application.command;

import com.ryuqq.guildkeeper.application.cache.GuildSettingsCache;
import com.ryuqq.guildkeeper.core.contract.Invocation;
import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.GuildSettings;
import com.ryuqq.guildkeeper.core.model.Prefix;
import com.ryuqq.guildkeeper.core.outcome.ErrorKind;
import com.ryuqq.guildkeeper.core.outcome.Fail;
import com.ryuqq.guildkeeper.core.outcome.Ok;
import com.ryuqq.guildkeeper.core.outcome.Outcome;
import com.ryuqq.guildkeeper.core.spi.Gateway;
import com.ryuqq.guildkeeper.core.spi.PermissionOracle;
import com.ryuqq.guildkeeper.core.spi.SettingsStore;
import com.ryuqq.guildkeeper.core.spi.StoreException;
import com.ryuqq.guildkeeper.core.spi.StoreWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * {@code prefix [new_prefix]} 명령 처리기.
 *
 * <p><strong>검증 순서 (앞 단계 실패 시 즉시 종료):</strong></p>
 * <ol>
 *   <li>길드 밖 (DM) → {@code Fail(MISSING_CONTEXT)}</li>
 *   <li>관리자 아님 → {@code Fail(PERMISSION_DENIED)}</li>
 *   <li>인자 없음 → 현재 prefix 조회 (캐시, 없으면 저장소 just-in-time 로드)</li>
 *   <li>인자에 공백 포함 → {@code Fail(VALIDATION_ERROR)}</li>
 *   <li>저장소 쓰기 → 성공 시에만 캐시 갱신 → {@code Ok}</li>
 * </ol>
 *
 * <p>검증 계열 실패는 저장소와 캐시를 건드리지 않습니다.
 * 모든 결과는 {@link Gateway#sendReply}로 호출 채널에 전달되며,
 * 응답 전송 실패는 로그만 남기고 결과를 바꾸지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PrefixCommand {

    private static final Logger log = LoggerFactory.getLogger(PrefixCommand.class);

    public static final String NAME = "prefix";

    private final SettingsStore store;
    private final GuildSettingsCache cache;
    private final PermissionOracle permissionOracle;
    private final Gateway gateway;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PrefixCommand(
        SettingsStore store,
        GuildSettingsCache cache,
        PermissionOracle permissionOracle,
        Gateway gateway
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (permissionOracle == null) {
            throw new IllegalArgumentException("permissionOracle cannot be null");
        }
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        this.store = store;
        this.cache = cache;
        this.permissionOracle = permissionOracle;
        this.gateway = gateway;
    }

    /**
     * 명령 실행 후 결과를 호출 채널에 응답.
     *
     * @param invocation 명령 호출 정보
     * @return 처리 결과 (Ok 또는 Fail)
     */
    public Outcome execute(Invocation invocation) {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        Outcome outcome = evaluate(invocation);
        reply(invocation, outcome);
        return outcome;
    }

    private Outcome evaluate(Invocation invocation) {
        Optional<GuildId> guild = invocation.guild();
        if (guild.isEmpty()) {
            return Fail.of(ErrorKind.MISSING_CONTEXT, PrefixReplies.directMessage());
        }
        GuildId guildId = guild.get();

        if (!permissionOracle.isAdministrator(guildId, invocation.invoker())) {
            log.debug("Prefix command denied: guildId={}, invoker={}", guildId, invocation.invoker());
            return Fail.of(ErrorKind.PERMISSION_DENIED, PrefixReplies.notAdministrator());
        }

        String argument = invocation.rawArgs().strip();
        if (argument.isEmpty()) {
            return view(guildId);
        }

        if (Prefix.containsWhitespace(argument)) {
            return Fail.of(ErrorKind.VALIDATION_ERROR, PrefixReplies.containsWhitespace(),
                "argument contains whitespace: '" + argument + "'");
        }

        return write(guildId, invocation, Prefix.of(argument));
    }

    private Outcome view(GuildId guildId) {
        Optional<GuildSettings> cached = cache.get(guildId);
        if (cached.isPresent()) {
            return Ok.of(guildId, PrefixReplies.current(cached.get().prefix()));
        }

        // 동시에 처리되는 탈퇴가 되살아나지 않도록 길드 락 안에서 로드
        Lock guildLock = cache.mutationLock(guildId);
        guildLock.lock();
        try {
            Optional<GuildSettings> loaded = cache.get(guildId);
            if (loaded.isPresent()) {
                return Ok.of(guildId, PrefixReplies.current(loaded.get().prefix()));
            }

            Optional<GuildSettings> stored;
            try {
                stored = store.find(guildId);
            } catch (StoreException e) {
                log.warn("Prefix lookup failed: guildId={}, error={}", guildId, e.getMessage());
                return Fail.of(ErrorKind.STORE_READ_FAILURE, PrefixReplies.readFailure(), e.getMessage());
            }

            if (stored.isEmpty()) {
                return Fail.of(ErrorKind.NOT_FOUND, PrefixReplies.notConfigured(),
                    "no settings for guild " + guildId.getValue());
            }
            GuildSettings row = cache.putIfAbsent(stored.get());
            return Ok.of(guildId, PrefixReplies.current(row.prefix()));
        } finally {
            guildLock.unlock();
        }
    }

    private Outcome write(GuildId guildId, Invocation invocation, Prefix prefix) {
        Lock guildLock = cache.mutationLock(guildId);
        guildLock.lock();
        try {
            Optional<GuildSettings> created;
            try {
                created = persist(guildId, invocation, prefix);
            } catch (StoreException e) {
                log.warn("Prefix not persisted: guildId={}, prefix={}, error={}", guildId, prefix, e.getMessage());
                return Fail.of(ErrorKind.STORE_WRITE_FAILURE, PrefixReplies.writeFailure(), e.getMessage());
            }

            // 저장소 확정 이후에만 캐시 반영
            if (created.isPresent()) {
                GuildSettings row = created.get();
                cache.upsert(guildId, () -> row, settings -> settings.withPrefix(prefix));
            } else {
                // 캐시에 없으면 다음 조회가 저장소에서 로드
                cache.updateIfPresent(guildId, settings -> settings.withPrefix(prefix));
            }
        } finally {
            guildLock.unlock();
        }

        log.info("Prefix changed: guildId={}, prefix={}, by={}", guildId, prefix, invocation.invoker());
        return Ok.of(guildId, PrefixReplies.prefixSet(prefix));
    }

    /**
     * 저장소에 prefix 기록.
     *
     * @return 행을 새로 만들었으면 그 행, 기존 행을 갱신했으면 empty
     */
    private Optional<GuildSettings> persist(GuildId guildId, Invocation invocation, Prefix prefix) {
        if (store.updatePrefix(guildId, prefix)) {
            return Optional.empty();
        }

        // 행이 없으면 호출자를 owner로 하여 생성
        GuildSettings created = GuildSettings.defaults(guildId, invocation.invoker()).withPrefix(prefix);
        if (store.insertIfAbsent(created)) {
            return Optional.of(created);
        }

        // 그 사이 다른 이벤트가 행을 만든 경우
        if (!store.updatePrefix(guildId, prefix)) {
            throw new StoreWriteException(
                "Settings row for guild " + guildId.getValue() + " disappeared during prefix update", guildId);
        }
        return Optional.empty();
    }

    private void reply(Invocation invocation, Outcome outcome) {
        try {
            gateway.sendReply(invocation.channelId(), outcome.message());
        } catch (RuntimeException e) {
            log.warn("Reply delivery failed: channelId={}, error={}", invocation.channelId(), e.getMessage());
        }
    }
}
