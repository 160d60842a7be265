package common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IceCandidate implements Serializable {
    private static final long serialVersionUID = 1L;

    private String candidate;
    private String sdpMid;
    private int sdpMLineIndex;
}
