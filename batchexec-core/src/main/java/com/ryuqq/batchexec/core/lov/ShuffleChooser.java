package com.ryuqq.batchexec.core.lov;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 섞은 뒤 첫 번째 원소를 고르는 {@link Chooser}.
 *
 * <p>{@link #shared()}는 프로세스 시작 시 한 번 시드된 난수원을 사용하며
 * 호출마다 다시 시드하지 않습니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public final class ShuffleChooser implements Chooser {

    private static final ShuffleChooser SHARED = new ShuffleChooser(new Random());

    private final Random random;

    /**
     * 생성자.
     *
     * @param random 난수원
     * @throws IllegalArgumentException random이 null인 경우
     */
    public ShuffleChooser(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    /**
     * 프로세스 공유 인스턴스.
     *
     * @return 공유 ShuffleChooser
     */
    public static ShuffleChooser shared() {
        return SHARED;
    }

    @Override
    public <T> T chooseOne(List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates cannot be null or empty");
        }
        List<T> mix = new ArrayList<>(candidates);
        synchronized (random) {
            Collections.shuffle(mix, random);
        }
        return mix.get(0);
    }
}
