package com.ucp.merchant.presentation.discovery;

import com.ucp.merchant.config.UcpProperties;
import com.ucp.merchant.presentation.discovery.response.DiscoveryProfileResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * DiscoveryController - UCP 디스커버리 문서 제공
 * 문서는 생성 시 한 번 조립되며 요청마다 계산하지 않는다.
 */
@RestController
public class DiscoveryController {

    private final DiscoveryProfileResponse profile;

    public DiscoveryController(UcpProperties properties) {
        this.profile = DiscoveryProfileFactory.build(properties);
    }

    /**
     * GET /.well-known/ucp
     */
    @GetMapping("/.well-known/ucp")
    public ResponseEntity<DiscoveryProfileResponse> getProfile() {
        return ResponseEntity.ok(profile);
    }
}
