package com.ryuqq.orchestration.adapter.runner.ratelimit;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Rate Limiter 앞에 놓이는 요청 대기열.
 *
 * <p><strong>정렬 규칙:</strong></p>
 * <ul>
 *   <li>FIFO: 등록 순서</li>
 *   <li>PRIORITY: 높은 우선순위 먼저. 나중에 등록된 HIGH 요청은 먼저 등록된 MEDIUM/LOW 요청보다 앞섭니다.
 *       같은 우선순위 안에서는 등록 순서</li>
 * </ul>
 *
 * <p>최대 크기에 도달하면 등록을 거부합니다. Thread-safe 합니다.</p>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public final class RequestQueue {

    /**
     * 기본 최대 크기.
     */
    public static final int DEFAULT_MAX_SIZE = 1000;

    private final QueueType type;
    private final int maxSize;
    private final PriorityQueue<Entry> entries;
    private long sequence;
    private long frontSequence;

    public RequestQueue(QueueType type) {
        this(type, DEFAULT_MAX_SIZE);
    }

    /**
     * 생성자.
     *
     * @param type 정렬 방식
     * @param maxSize 최대 크기 (양수)
     */
    public RequestQueue(QueueType type, int maxSize) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        this.type = type;
        this.maxSize = maxSize;
        Comparator<Entry> bySequence = Comparator.comparingLong(Entry::sequence);
        Comparator<Entry> order = type == QueueType.PRIORITY
            ? Comparator.<Entry>comparingInt(e -> -e.request().priority().weight()).thenComparing(bySequence)
            : bySequence;
        this.entries = new PriorityQueue<>(order);
    }

    /**
     * 요청 등록 (대기열 끝).
     *
     * @param request 요청
     * @return 등록 성공 여부 (가득 찬 경우 false)
     */
    public synchronized boolean enqueue(QueuedRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (entries.size() >= maxSize) {
            return false;
        }
        entries.add(new Entry(request, sequence++));
        return true;
    }

    /**
     * 방금 꺼낸 요청을 같은 우선순위의 맨 앞으로 되돌리기.
     *
     * <p>admission 거부로 처리하지 못한 요청이 순서를 잃지 않도록 합니다.
     * 최대 크기 검사는 하지 않습니다.</p>
     *
     * @param request 되돌릴 요청
     */
    public synchronized void pushFront(QueuedRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        entries.add(new Entry(request, --frontSequence));
    }

    /**
     * 다음 요청 꺼내기.
     *
     * @return 다음 요청 (비어 있으면 null)
     */
    public synchronized QueuedRequest dequeue() {
        Entry entry = entries.poll();
        return entry == null ? null : entry.request();
    }

    /**
     * 다음 요청 조회 (꺼내지 않음).
     *
     * @return 다음 요청 (비어 있으면 null)
     */
    public synchronized QueuedRequest peek() {
        Entry entry = entries.peek();
        return entry == null ? null : entry.request();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public QueueType getType() {
        return type;
    }

    public int getMaxSize() {
        return maxSize;
    }

    private record Entry(QueuedRequest request, long sequence) {
    }
}
