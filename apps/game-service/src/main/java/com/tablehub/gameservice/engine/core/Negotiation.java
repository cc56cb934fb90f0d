package com.tablehub.gameservice.engine.core;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 议价子结构：仅在 {@link TurnPhase#AWAITING_RESPONSES} 期间存在。
 * <ul>
 *   <li>offererSeat：发起方座位下标；</li>
 *   <li>offerCounts / requestCounts：发起方给出 / 索取的资源向量；</li>
 *   <li>responseBitmap：各座位是否已响应；acceptBitmap：已响应者是否接受。</li>
 * </ul>
 */
@Data
@NoArgsConstructor
public class Negotiation {
    private int offererSeat;
    private int[] offerCounts;
    private int[] requestCounts;
    private boolean[] responseBitmap;
    private boolean[] acceptBitmap;

    public static Negotiation open(int offererSeat, int[] offer, int[] request, int seatCount) {
        Negotiation n = new Negotiation();
        n.setOffererSeat(offererSeat);
        n.setOfferCounts(offer.clone());
        n.setRequestCounts(request.clone());
        n.setResponseBitmap(new boolean[seatCount]);
        n.setAcceptBitmap(new boolean[seatCount]);
        return n;
    }

    public boolean responded(int seat) {
        return responseBitmap[seat];
    }

    public void record(int seat, boolean accept) {
        responseBitmap[seat] = true;
        acceptBitmap[seat] = accept;
    }

    /** 除发起方外是否全部响应 */
    public boolean complete() {
        for (int i = 0; i < responseBitmap.length; i++) {
            if (i != offererSeat && !responseBitmap[i]) {
                return false;
            }
        }
        return true;
    }

    public Negotiation copy() {
        Negotiation c = new Negotiation();
        c.setOffererSeat(offererSeat);
        c.setOfferCounts(offerCounts.clone());
        c.setRequestCounts(requestCounts.clone());
        c.setResponseBitmap(responseBitmap.clone());
        c.setAcceptBitmap(acceptBitmap.clone());
        return c;
    }
}
