package com.example.spacewars.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User Not Found"),
    USERNAME_TAKEN(HttpStatus.CONFLICT, "USERNAME_TAKEN", "Username Already Taken"),
    SHIP_NOT_FOUND(HttpStatus.BAD_REQUEST, "SHIP_NOT_FOUND", "Ship Not Found"),
    BATTLE_NOT_FOUND(HttpStatus.NOT_FOUND, "BATTLE_NOT_FOUND", "Battle Not Found"),
    ALREADY_IN_BATTLE(HttpStatus.CONFLICT, "ALREADY_IN_BATTLE", "Attacker Is Already In Battle"),
    TARGET_ALREADY_IN_BATTLE(HttpStatus.CONFLICT, "TARGET_ALREADY_IN_BATTLE", "Target Is Already In Battle"),
    CANNOT_ATTACK_SELF(HttpStatus.BAD_REQUEST, "CANNOT_ATTACK_SELF", "Cannot Attack Yourself"),
    TARGET_OUT_OF_RANGE(HttpStatus.BAD_REQUEST, "TARGET_OUT_OF_RANGE", "Target Is Out Of Range"),
    NO_WEAPONS_EQUIPPED(HttpStatus.BAD_REQUEST, "NO_WEAPONS_EQUIPPED", "No Weapons Equipped"),
    BATTLE_ALREADY_ENDED(HttpStatus.CONFLICT, "BATTLE_ALREADY_ENDED", "Battle Already Ended"),
    BATTLE_NOT_OVER(HttpStatus.CONFLICT, "BATTLE_NOT_OVER", "Battle Is Not Over"),
    PERSISTENCE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "PERSISTENCE_FAILURE", "Persistence Failure"),
    ;
    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.message = message;
        this.code = code;
    }

    public CommonException commonException() {return new CommonException(this);}

    public CommonException commonException(String detail) {return new CommonException(this, detail);}
}
