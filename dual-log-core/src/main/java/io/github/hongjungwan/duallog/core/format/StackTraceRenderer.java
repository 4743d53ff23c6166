package io.github.hongjungwan.duallog.core.format;

import java.util.List;
import java.util.Set;

/**
 * 스택 트레이스 블록 렌더링. 파이프라인 자신의 안쪽 프레임은 건너뛰고 최대 프레임 수로 자른다.
 */
public class StackTraceRenderer {

    /** 캡처 경로에 있는 파이프라인 클래스 (중첩 클래스 포함) */
    static final Set<String> PIPELINE_CLASSES = Set.of(
            "java.lang.Thread",
            "io.github.hongjungwan.duallog.api.DualLogger",
            "io.github.hongjungwan.duallog.core.internal.DefaultDualLogger",
            "io.github.hongjungwan.duallog.core.internal.DefaultLogPipeline"
    );

    private static final String FRAME_PREFIX = "\n    at ";

    private final int maxFrames;

    public StackTraceRenderer(int maxFrames) {
        this.maxFrames = maxFrames;
    }

    /** 각 프레임을 {@code "\n    at frame"} 으로 이어붙인 블록. 프레임이 없으면 빈 문자열. */
    public String render(List<StackTraceElement> frames) {
        if (frames == null || frames.isEmpty()) {
            return "";
        }

        int start = 0;
        while (start < frames.size() && isPipelineFrame(frames.get(start))) {
            start++;
        }

        StringBuilder sb = new StringBuilder();
        int end = Math.min(frames.size(), start + maxFrames);
        for (int i = start; i < end; i++) {
            sb.append(FRAME_PREFIX).append(frames.get(i));
        }
        return sb.toString();
    }

    static boolean isPipelineFrame(StackTraceElement frame) {
        String className = frame.getClassName();
        for (String pipelineClass : PIPELINE_CLASSES) {
            if (className.equals(pipelineClass) || className.startsWith(pipelineClass + "$")) {
                return true;
            }
        }
        return false;
    }
}
