package com.alonica.pos.domain.auth;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Actor - 요청을 보낸 사용자 (인증 협력자가 넘겨준 값)
 *
 * 요청마다 한 번 해석되어 컨트롤러 파라미터로 전달된다.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(staticName = "of")
public class Actor {

    private final Long userId;
    private final UserRole role;

    public boolean can(Capability capability) {
        return role.can(capability);
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
