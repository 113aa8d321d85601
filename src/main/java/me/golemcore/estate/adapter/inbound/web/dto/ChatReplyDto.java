package me.golemcore.estate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatReplyDto {
    private String text;
    private boolean endOfTurn;
    private String timestamp;
}
