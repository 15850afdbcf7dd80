package com.ryuqq.guildkeeper.core.contract;

import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.UserId;

import java.util.Optional;

/**
 * 명령어 호출 컨텍스트.
 *
 * <p>명령어 프레임워크가 메시지를 파싱한 뒤 넘겨주는 값입니다.
 * 다이렉트 메시지에서 호출된 경우 guildId는 null입니다.</p>
 *
 * @param guildId 호출된 길드 (DM이면 null)
 * @param channelId 응답을 보낼 채널 ID
 * @param invoker 호출자
 * @param rawArgs 명령어 이름 뒤의 원본 인자 문자열 (없으면 빈 문자열)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Invocation(
    GuildId guildId,
    long channelId,
    UserId invoker,
    String rawArgs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException invoker가 null이거나 channelId가 양수가 아닌 경우
     */
    public Invocation {
        if (channelId <= 0) {
            throw new IllegalArgumentException("channelId must be positive (current: " + channelId + ")");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (rawArgs == null) {
            rawArgs = "";
        }
        // guildId는 null 허용 (DM)
    }

    /**
     * 길드 채널에서의 호출 생성.
     */
    public static Invocation inGuild(GuildId guildId, long channelId, UserId invoker, String rawArgs) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        return new Invocation(guildId, channelId, invoker, rawArgs);
    }

    /**
     * 다이렉트 메시지에서의 호출 생성.
     */
    public static Invocation directMessage(long channelId, UserId invoker, String rawArgs) {
        return new Invocation(null, channelId, invoker, rawArgs);
    }

    /**
     * 호출된 길드 조회.
     *
     * @return 길드 ID (DM이면 empty)
     */
    public Optional<GuildId> guild() {
        return Optional.ofNullable(guildId);
    }

    public boolean isDirectMessage() {
        return guildId == null;
    }
}
