package com.ryuqq.analysis.adapter.file.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.UUID;

/**
 * 원자적 파일 쓰기.
 *
 * <p>같은 디렉토리의 임시 파일에 쓰고 fsync한 뒤 rename합니다.
 * 읽는 쪽은 완전한 이전 내용 또는 완전한 새 내용만 봅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    /**
     * 임시 파일 접두사. 목록 조회 시 이 접두사를 가진 파일은 건너뜁니다.
     */
    public static final String TEMP_PREFIX = ".tmp-";

    private AtomicFiles() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 대상 파일을 원자적으로 교체.
     *
     * @param target 대상 경로
     * @param bytes 내용
     * @param modifiedAt 기록할 수정 시각 (null이면 파일 시스템 기본값)
     * @throws IOException 쓰기 실패 시 (임시 파일은 정리됨)
     */
    public static void write(Path target, byte[] bytes, Instant modifiedAt) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(TEMP_PREFIX + target.getFileName() + "-" + UUID.randomUUID());

        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            if (modifiedAt != null) {
                Files.setLastModifiedTime(temp, FileTime.from(modifiedAt));
            }

            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public static boolean isTemporary(Path path) {
        return path.getFileName().toString().startsWith(TEMP_PREFIX);
    }
}
