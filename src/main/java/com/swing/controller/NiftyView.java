package com.swing.controller;

import com.swing.model.IndexSnapshot;

import static com.swing.controller.Rounding.round;

/**
 * Index level in the stocks response; {@code available=false} until a level has been fetched.
 */
public record NiftyView(String symbol, double price, double change, double changePct, boolean available) {

    public static NiftyView from(IndexSnapshot index) {
        return new NiftyView(index.symbol(), round(index.price()), round(index.change()),
                round(index.changePct()), index.available());
    }
}
