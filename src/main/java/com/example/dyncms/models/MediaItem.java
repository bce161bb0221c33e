package com.example.dyncms.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Read-only view of the media library's table. Uploads are owned by the media service; this
 * service only resolves ids referenced from media fields.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@Getter @Setter
public class MediaItem {

    private String mediaId;
    private String name;
    private String url;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("media_id")
    public String getMediaId() { return mediaId; }

    @DynamoDbAttribute("name")
    public String getName() { return name; }

    @DynamoDbAttribute("url")
    public String getUrl() { return url; }
}
