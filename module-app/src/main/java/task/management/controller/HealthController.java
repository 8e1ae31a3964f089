package task.management.controller;

import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** 단순 헬스 체크 (인증 불필요). 상세 상태는 /actuator/health */
@RestController
public class HealthController {

  @GetMapping("/api/v1/health")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }
}
