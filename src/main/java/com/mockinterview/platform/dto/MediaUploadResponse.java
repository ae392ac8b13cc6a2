package com.mockinterview.platform.dto;

import com.mockinterview.platform.model.MediaFile;
import com.mockinterview.platform.model.MediaKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MediaUploadResponse {
    private MediaKind kind;
    private Integer sequence;
    private String filePath;
    private Long sizeBytes;

    public static MediaUploadResponse from(MediaFile mediaFile) {
        return new MediaUploadResponse(mediaFile.getKind(), mediaFile.getSequence(),
                mediaFile.getFilePath(), mediaFile.getSizeBytes());
    }
}
