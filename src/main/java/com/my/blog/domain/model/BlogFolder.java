package com.my.blog.domain.model;

/**
 * 왜: 원격 저장소의 고정 폴더 배치를 한 곳에서 정의해 경로 조합이 흩어지지 않도록 하기 위함.
 */
public enum BlogFolder {
    POSTS("posts"),
    DRAFTS("drafts"),
    MEDIA("media"),
    TEMPLATES("templates"),
    CONFIG("config");

    private final String folderName;

    BlogFolder(String folderName) {
        this.folderName = folderName;
    }

    public String folderName() {
        return folderName;
    }

    public String pathUnder(String root) {
        return normalizeRoot(root) + "/" + folderName;
    }

    public String filePath(String root, String fileName) {
        return pathUnder(root) + "/" + fileName;
    }

    static String normalizeRoot(String root) {
        if (root == null || root.isBlank() || root.equals("/")) {
            return "";
        }
        String trimmed = root.strip();
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
