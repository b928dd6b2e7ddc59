package com.my.blog.domain.port.out;

import com.my.blog.domain.model.AccountInfo;
import com.my.blog.domain.model.FolderPage;
import com.my.blog.domain.model.RemoteEntry;

/**
 * 왜: 원격 파일 저장소의 HTTP API 를 최소한의 원시 연산으로 추상화하여 글 저장소가 전송 세부사항에 종속되지 않도록 하기 위함.
 * <p>
 * 구현체는 내부에서 재시도하지 않는다. 실패는 {@code com.my.blog.domain.exception} 의
 * RemoteStoreException 하위 타입으로 전달된다.
 */
public interface RemoteFilePort {

    AccountInfo testConnection();

    FolderPage listFolder(String path);

    FolderPage listFolderContinue(String cursor);

    byte[] downloadFile(String path);

    /** 덮어쓰기 모드 업로드. 같은 내용으로 반복 호출해도 결과가 같다. */
    RemoteEntry uploadFile(String path, byte[] content);

    RemoteEntry deleteFile(String path);

    RemoteEntry createFolder(String path);
}
