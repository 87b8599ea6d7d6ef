package com.shopflow.gateway.routing;

import com.shopflow.gateway.config.GatewayRoutingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 라우팅 테이블 - 불변 스냅샷을 AtomicReference로 교체하는 구조
 *
 * <h3>동시성 모델</h3>
 * <pre>
 * 요청 스레드 (다수)      → snapshot.get()으로 읽기만 (락 없음)
 * 헬스 체커 (단일 작업)   → 엔트리 하나를 바꾼 새 리스트를 만들어 통째로 교체
 * </pre>
 *
 * 엔트리는 기동 시 설정에서 만들어지고 프로세스가 끝날 때까지 제거되지 않는다.
 * 스냅샷은 접두사 길이 내림차순으로 정렬되어 있어 첫 번째 일치가 가장 긴 접두사다.
 */
@Slf4j
@Component
public class RoutingTable {

    private final AtomicReference<List<RoutingEntry>> snapshot;
    private final int failureThreshold;

    public RoutingTable(GatewayRoutingProperties properties) {
        this(properties.services().stream()
                        .map(s -> RoutingEntry.initial(s.name(), s.pathPrefix(), s.baseAddress()))
                        .toList(),
                properties.failureThreshold());
    }

    public RoutingTable(List<RoutingEntry> entries, int failureThreshold) {
        validate(entries);
        this.snapshot = new AtomicReference<>(sorted(entries));
        this.failureThreshold = failureThreshold;
        log.info("Routing table loaded: services={}, failureThreshold={}",
                entries.stream().map(RoutingEntry::serviceName).toList(), failureThreshold);
    }

    /** 경로에 일치하는 가장 긴 접두사의 엔트리 */
    public Optional<RoutingEntry> match(String path) {
        for (RoutingEntry entry : snapshot.get()) {
            if (entry.matches(path)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public Optional<RoutingEntry> find(String serviceName) {
        return snapshot.get().stream()
                .filter(entry -> entry.serviceName().equals(serviceName))
                .findFirst();
    }

    /** 현재 스냅샷 (불변 리스트) */
    public List<RoutingEntry> entries() {
        return snapshot.get();
    }

    /**
     * 프로브 결과를 반영한 새 스냅샷으로 교체한다.
     *
     * @return 갱신된 엔트리
     */
    public RoutingEntry recordProbe(String serviceName, boolean success) {
        List<RoutingEntry> updated = snapshot.updateAndGet(current -> current.stream()
                .map(entry -> entry.serviceName().equals(serviceName)
                        ? entry.afterProbe(success, failureThreshold)
                        : entry)
                .toList());
        return updated.stream()
                .filter(entry -> entry.serviceName().equals(serviceName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown service: " + serviceName));
    }

    private static List<RoutingEntry> sorted(List<RoutingEntry> entries) {
        List<RoutingEntry> copy = new ArrayList<>(entries);
        copy.sort(Comparator.comparingInt((RoutingEntry e) -> e.pathPrefix().length()).reversed());
        return List.copyOf(copy);
    }

    private static void validate(List<RoutingEntry> entries) {
        Set<String> names = new HashSet<>();
        Set<String> prefixes = new HashSet<>();
        for (RoutingEntry entry : entries) {
            if (!names.add(entry.serviceName())) {
                throw new IllegalStateException("Duplicate service in routing table: " + entry.serviceName());
            }
            if (!prefixes.add(entry.pathPrefix())) {
                throw new IllegalStateException("Duplicate path prefix in routing table: " + entry.pathPrefix());
            }
        }
    }
}
