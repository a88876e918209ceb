@NamedInterface("exception")
package kr.jemi.zevent.common.exception;

import org.springframework.modulith.NamedInterface;
