package com.pairup.server.im.web;

import com.pairup.server.im.push.PushService;
import com.pairup.server.im.web.dto.PushRegisterRequest;
import com.pairup.server.im.web.dto.PushUnregisterRequest;
import com.pairup.server.im.web.dto.StatusResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/push")
public class PushTokenController {

    private final PushService pushService;

    @PostMapping("/register")
    public ResponseEntity<StatusResponse> register(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                   @RequestBody PushRegisterRequest request) {
        pushService.saveToken(userId, request.getToken(), request.getPlatform(), request.getDeviceId());
        return ResponseEntity.ok(new StatusResponse("success"));
    }

    @DeleteMapping("/unregister")
    public ResponseEntity<StatusResponse> unregister(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                     @RequestBody PushUnregisterRequest request) {
        pushService.deleteToken(userId, request.getToken());
        return ResponseEntity.ok(new StatusResponse("success"));
    }
}
